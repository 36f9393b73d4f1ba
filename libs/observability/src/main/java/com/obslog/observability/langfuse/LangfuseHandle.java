package com.obslog.observability.langfuse;

/**
 * Either a usable Langfuse client or the explicit absence of one.
 * <p>
 * Call sites check {@code handle instanceof LangfuseHandle.Active active} instead of
 * null-checking a client reference.
 */
public sealed interface LangfuseHandle permits LangfuseHandle.Disabled, LangfuseHandle.Active {

    static LangfuseHandle disabled() {
        return Disabled.INSTANCE;
    }

    static LangfuseHandle active(LangfuseClient client) {
        return new Active(client);
    }

    /**
     * Tracing is off: settings incomplete, disabled, or client construction failed.
     */
    final class Disabled implements LangfuseHandle {

        private static final Disabled INSTANCE = new Disabled();

        private Disabled() {
        }

        @Override
        public String toString() {
            return "LangfuseHandle.Disabled";
        }
    }

    /**
     * Tracing is on.
     *
     * @param client the client to trace with
     */
    record Active(LangfuseClient client) implements LangfuseHandle {

        public Active {
            if (client == null) {
                throw new IllegalArgumentException("client must not be null");
            }
        }
    }
}
