package org.themecheck.checks;

import java.util.function.Function;

/**
 * Builds throwaway check definitions for engine tests.
 */
final class TestChecks {

    private TestChecks() {}

    static ICheckDefinition check(String code, Function<CheckContext, HandlerTable> factory) {
        return check(code, CheckSchema.empty(), factory);
    }

    static ICheckDefinition check(String code, CheckSchema schema, Function<CheckContext, HandlerTable> factory) {
        CheckMeta meta = new CheckMeta(code, code, new CheckDocs("Test check " + code, null, true),
                Severity.WARNING, schema);
        return new ICheckDefinition() {
            @Override
            public CheckMeta meta() {
                return meta;
            }

            @Override
            public HandlerTable create(CheckContext context) {
                return factory.apply(context);
            }
        };
    }
}
