package com.vidnyan.codesense.application.port.out;

import com.vidnyan.codesense.domain.rule.RuleCatalog;

/**
 * Port for loading the anti-pattern rule catalog.
 * The catalog is loaded once and read-only afterwards.
 */
public interface RuleRepository {

    /**
     * The loaded catalog.
     */
    RuleCatalog catalog();
}
