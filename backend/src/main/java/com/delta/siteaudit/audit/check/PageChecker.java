package com.delta.siteaudit.audit.check;

import com.delta.siteaudit.audit.model.BotAccessReport;
import com.delta.siteaudit.audit.model.PerformanceReport;
import com.delta.siteaudit.audit.model.StructuralReport;

/**
 * The three independent audits that can be run against one page. Calls are side-effect free on
 * the audited site and each one costs a single upstream request.
 *
 * <p>Implementations report failures by throwing: {@link CheckTimeoutException} when the upstream
 * did not answer in time, {@link CheckFailedException} (or any other runtime exception) otherwise.
 */
public interface PageChecker {

    StructuralReport checkStructural(String url);

    PerformanceReport checkPerformance(String url);

    BotAccessReport checkBotAccess(String url);
}
