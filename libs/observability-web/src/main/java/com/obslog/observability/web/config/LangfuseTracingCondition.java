package com.obslog.observability.web.config;

import com.obslog.observability.langfuse.LangfuseSettings;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when {@code langfuse.*} properties (or the {@code LANGFUSE_*} environment) enable
 * tracing and name a host and both keys.
 */
class LangfuseTracingCondition extends SpringBootCondition {

    @Override
    public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
        LangfuseProperties properties = Binder.get(context.getEnvironment())
                .bind("langfuse", LangfuseProperties.class)
                .orElseGet(() -> new LangfuseProperties(null, null, null, null, null));
        LangfuseSettings settings = properties.toSettings(context.getEnvironment()::getProperty);
        if (settings.isConfiguredForTracing()) {
            return ConditionOutcome.match("Langfuse tracing configured for " + settings.host());
        }
        return ConditionOutcome.noMatch("Langfuse tracing disabled or credentials missing");
    }
}
