package com.linbit.lzc.errors;

import com.linbit.lzc.Errno;

import javax.annotation.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Ordered list of classification rules for the status codes of one libzfs_core operation
 *
 * Each rule consists of a status code, a condition and the resulting failure. The first rule
 * whose status code matches and whose condition holds determines the failure. Conditions are
 * only evaluated for matching status codes, in the order the rules were added. If no rule
 * applies, the failure is classified as {@link ZfsErrorKind#GENERIC}.
 */
final class ErrorRuleChain
{
    interface Outcome
    {
        ZfsErrorException create(int status);
    }

    private static final BooleanSupplier ALWAYS = () -> true;

    private static class Rule
    {
        private final int errno;
        private final BooleanSupplier condition;
        private final Outcome outcome;

        Rule(int errnoRef, BooleanSupplier conditionRef, Outcome outcomeRef)
        {
            errno = errnoRef;
            condition = conditionRef;
            outcome = outcomeRef;
        }
    }

    private final String operationDescription;
    private final @Nullable String genericName;
    private final List<Rule> rules = new ArrayList<>();

    /**
     * @param operationDescriptionRef Describes the failed operation in generic failures
     * @param genericNameRef The name that generic failures refer to
     */
    ErrorRuleChain(String operationDescriptionRef, @Nullable String genericNameRef)
    {
        operationDescription = operationDescriptionRef;
        genericName = genericNameRef;
    }

    ErrorRuleChain when(int errno, BooleanSupplier condition, ZfsErrorKind kind, @Nullable String name)
    {
        return when(errno, condition, status -> new ZfsErrorException(kind, status, name));
    }

    ErrorRuleChain when(int errno, BooleanSupplier condition, Outcome outcome)
    {
        rules.add(new Rule(errno, condition, outcome));
        return this;
    }

    ErrorRuleChain on(int errno, ZfsErrorKind kind, @Nullable String name)
    {
        return when(errno, ALWAYS, kind, name);
    }

    ErrorRuleChain on(int errno, Outcome outcome)
    {
        return when(errno, ALWAYS, outcome);
    }

    ZfsErrorException classify(int status)
    {
        ZfsErrorException failure = null;
        for (Rule rule : rules)
        {
            if (rule.errno == status && rule.condition.getAsBoolean())
            {
                failure = rule.outcome.create(status);
                break;
            }
        }
        if (failure == null)
        {
            failure = generic(status, genericName, operationDescription);
        }
        return failure;
    }

    static ZfsErrorException generic(int status, @Nullable String name, String operationDescription)
    {
        return new ZfsErrorException(
            ZfsErrorKind.GENERIC,
            status,
            name,
            operationDescription + " (" + Errno.describe(status) + ")"
        );
    }
}
