package com.alert.triage.core.rules;

import com.alert.triage.domain.Verdict;
import lombok.Value;

/**
 * What a business rule decided, and why in words an operator can read.
 */
@Value
public class RuleOutcome {

    Verdict verdict;
    String detail;

    public static RuleOutcome suppress(String detail) {
        return new RuleOutcome(Verdict.SUPPRESS, detail);
    }

    public static RuleOutcome keep(String detail) {
        return new RuleOutcome(Verdict.KEEP, detail);
    }
}
