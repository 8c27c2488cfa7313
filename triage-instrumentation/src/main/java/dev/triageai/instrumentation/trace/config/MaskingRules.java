package dev.triageai.instrumentation.trace.config;

import dev.triageai.semconv.trace.SemanticConventions;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import lombok.Builder;
import lombok.Getter;

/**
 * Arguments for masking rules
 */
@Getter
@Builder
class MaskingRuleArgs {
    private boolean traceContent;
    private String key;
    private Object value;
}

/**
 * A masking rule that defines when and how to mask attributes
 */
@Getter
class MaskingRule {
    private final Predicate<MaskingRuleArgs> condition;
    private final Function<MaskingRuleArgs, Object> action;

    public MaskingRule(Predicate<MaskingRuleArgs> condition, Function<MaskingRuleArgs, Object> action) {
        this.condition = condition;
        this.action = action;
    }
}

/**
 * Utility class for dropping message content from span attributes when content tracing is off
 */
class MaskingUtils {

    private static final String PROMPT_PREFIX = SemanticConventions.GEN_AI_PROMPT + ".";
    private static final String COMPLETION_PREFIX = SemanticConventions.GEN_AI_COMPLETION + ".";
    private static final String TOOLS_PREFIX = SemanticConventions.GEN_AI_REQUEST_TOOLS + ".";

    /**
     * Removes prompt messages: every key under `gen_ai.prompt.[i]`.
     */
    private static final MaskingRule maskPromptMessagesRule = new MaskingRule(
            args -> !args.isTraceContent() && args.getKey().startsWith(PROMPT_PREFIX), args -> null);

    /**
     * Removes completion messages: every key under `gen_ai.completion.[i]`.
     */
    private static final MaskingRule maskCompletionMessagesRule = new MaskingRule(
            args -> !args.isTraceContent() && args.getKey().startsWith(COMPLETION_PREFIX), args -> null);

    /**
     * Removes tool definitions: every key under `gen_ai.request.tools.[i]`.
     */
    private static final MaskingRule maskToolDefinitionsRule = new MaskingRule(
            args -> !args.isTraceContent() && args.getKey().startsWith(TOOLS_PREFIX), args -> null);

    private static final List<MaskingRule> maskingRules =
            Arrays.asList(maskPromptMessagesRule, maskCompletionMessagesRule, maskToolDefinitionsRule);

    /**
     * @return null if the attribute should be dropped, otherwise the value to record
     */
    public static Object mask(MaskingRuleArgs args) {
        for (MaskingRule rule : maskingRules) {
            if (rule.getCondition().test(args)) {
                return rule.getAction().apply(args);
            }
        }
        return args.getValue();
    }

    public static Object mask(boolean traceContent, String key, Object value) {
        return mask(MaskingRuleArgs.builder()
                .traceContent(traceContent)
                .key(key)
                .value(value)
                .build());
    }
}
