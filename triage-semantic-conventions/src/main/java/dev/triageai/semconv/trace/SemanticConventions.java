package dev.triageai.semconv.trace;

import lombok.experimental.UtilityClass;

public class SemanticConventions {
    @UtilityClass
    public static class SemanticAttributePrefixes {
        public static final String TRIAGE = "triage";
        public static final String GEN_AI = "gen_ai";
        public static final String LLM = "llm";
        public static final String TRACELOOP = "traceloop";
    }

    @UtilityClass
    public static class TriageAttributePostfixes {
        public static final String USER = "user";
        public static final String TENANT = "tenant";
        public static final String SESSION = "session";
        public static final String INPUT = "input";
        public static final String TEMPLATE = "template";
        public static final String CHUNK_ACLS = "chunk_acls";
        public static final String SDK = "sdk";
    }

    @UtilityClass
    public static class GenAIAttributePostfixes {
        public static final String SYSTEM = "system";
        public static final String REQUEST = "request";
        public static final String RESPONSE = "response";
        public static final String USAGE = "usage";
        public static final String PROMPT = "prompt";
        public static final String COMPLETION = "completion";
    }

    @UtilityClass
    public static class MessageAttributePostfixes {
        public static final String ROLE = "role";
        public static final String CONTENT = "content";
        public static final String TOOL_CALLS = "tool_calls";
        public static final String TOOL_CALL_ID = "tool_call_id";
    }

    @UtilityClass
    public static class ToolCallAttributePostfixes {
        public static final String ID = "id";
        public static final String TYPE = "type";
        public static final String NAME = "name";
        public static final String ARGUMENTS = "arguments";
        public static final String FUNCTION_NAME = "function.name";
        public static final String FUNCTION_ARGUMENTS = "function.arguments";
    }

    @UtilityClass
    public static class ToolAttributePostfixes {
        public static final String NAME = "name";
        public static final String DESCRIPTION = "description";
        public static final String PARAMETERS = "parameters";
    }

    /** The application user the request is made on behalf of */
    public static final String TRIAGE_USER_ID =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.USER + ".id";

    /** The role of the user, e.g. "admin" or "viewer" */
    public static final String TRIAGE_USER_ROLE =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.USER + ".role";

    /** The tenant or organization id */
    public static final String TRIAGE_TENANT_ID =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.TENANT + ".id";

    /** The tenant or organization display name */
    public static final String TRIAGE_TENANT_NAME =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.TENANT + ".name";

    /** The conversation session id. Used to correlate spans of a single conversation. */
    public static final String TRIAGE_SESSION_ID =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.SESSION + ".id";

    /** The turn number within the session (integer, zero is a valid turn) */
    public static final String TRIAGE_SESSION_TURN_NUMBER =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.SESSION + ".turn_number";

    /** A hash of the session history up to this turn */
    public static final String TRIAGE_SESSION_HISTORY_HASH =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.SESSION + ".history_hash";

    /** The user input exactly as received */
    public static final String TRIAGE_INPUT_RAW =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.INPUT + ".raw";

    /** The user input after application-side sanitization */
    public static final String TRIAGE_INPUT_SANITIZED =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.INPUT + ".sanitized";

    /** The prompt template identifier */
    public static final String TRIAGE_TEMPLATE_ID =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.TEMPLATE + ".id";

    /** The prompt template version */
    public static final String TRIAGE_TEMPLATE_VERSION =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.TEMPLATE + ".version";

    /**
     * Access control metadata of the retrieved chunks, as a JSON string
     */
    public static final String TRIAGE_CHUNK_ACLS =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.CHUNK_ACLS;

    public static final String TRIAGE_SDK_NAME =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.SDK + ".name";

    public static final String TRIAGE_SDK_VERSION =
            SemanticAttributePrefixes.TRIAGE + "." + TriageAttributePostfixes.SDK + ".version";

    /**
     * The vendor of the model, e.g. "openai" or "anthropic"
     */
    public static final String GEN_AI_SYSTEM = SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.SYSTEM;

    public static final String GEN_AI_REQUEST_MODEL =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.REQUEST + ".model";

    public static final String GEN_AI_REQUEST_TEMPERATURE =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.REQUEST + ".temperature";

    public static final String GEN_AI_REQUEST_TOP_P =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.REQUEST + ".top_p";

    public static final String GEN_AI_REQUEST_FREQUENCY_PENALTY =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.REQUEST + ".frequency_penalty";

    public static final String GEN_AI_REQUEST_PRESENCE_PENALTY =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.REQUEST + ".presence_penalty";

    public static final String GEN_AI_REQUEST_MAX_TOKENS =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.REQUEST + ".max_tokens";

    public static final String GEN_AI_REQUEST_STOP_SEQUENCES =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.REQUEST + ".stop_sequences";

    /**
     * Prefix of the tool definitions offered to the model, indexed by position:
     * {@code gen_ai.request.tools.<i>.name}
     */
    public static final String GEN_AI_REQUEST_TOOLS =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.REQUEST + ".tools";

    /**
     * Prefix of the prompt messages, indexed by position: {@code gen_ai.prompt.<i>.role}
     */
    public static final String GEN_AI_PROMPT = SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.PROMPT;

    /**
     * Prefix of the completion messages, indexed by position: {@code gen_ai.completion.<i>.content}
     */
    public static final String GEN_AI_COMPLETION =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.COMPLETION;

    /** The model that actually served the request, which may differ from the requested one */
    public static final String GEN_AI_RESPONSE_MODEL =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.RESPONSE + ".model";

    public static final String GEN_AI_RESPONSE_FINISH_REASON =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.RESPONSE + ".finish_reason";

    public static final String GEN_AI_USAGE_INPUT_TOKENS =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.USAGE + ".input_tokens";

    public static final String GEN_AI_USAGE_OUTPUT_TOKENS =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.USAGE + ".output_tokens";

    public static final String GEN_AI_USAGE_TOTAL_TOKENS =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.USAGE + ".total_tokens";

    public static final String GEN_AI_USAGE_REASONING_TOKENS =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.USAGE + ".reasoning_tokens";

    public static final String GEN_AI_USAGE_CACHE_READ_TOKENS =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.USAGE + ".cache_read_tokens";

    public static final String GEN_AI_USAGE_CACHE_WRITE_TOKENS =
            SemanticAttributePrefixes.GEN_AI + "." + GenAIAttributePostfixes.USAGE + ".cache_write_tokens";

    /*
     * Compatibility attributes, recorded alongside the gen_ai.* ones for consumers of the older llm.* schema
     */
    public static final String LLM_VENDOR = SemanticAttributePrefixes.LLM + ".vendor";

    public static final String LLM_REQUEST_MODEL = SemanticAttributePrefixes.LLM + ".request.model";

    public static final String LLM_REQUEST_TYPE = SemanticAttributePrefixes.LLM + ".request.type";

    public static final String LLM_RESPONSE_MODEL = SemanticAttributePrefixes.LLM + ".response.model";

    public static final String LLM_USAGE_PROMPT_TOKENS = SemanticAttributePrefixes.LLM + ".usage.prompt_tokens";

    public static final String LLM_USAGE_COMPLETION_TOKENS =
            SemanticAttributePrefixes.LLM + ".usage.completion_tokens";

    public static final String LLM_USAGE_TOTAL_TOKENS = SemanticAttributePrefixes.LLM + ".usage.total_tokens";

    /**
     * The name of the agent. Agents that perform the same functions should have the same name.
     */
    public static final String LLM_AGENT_NAME = SemanticAttributePrefixes.LLM + ".agent.name";

    /**
     * The structural role of a span in an agent pipeline, one of {@link HierarchySpanKind}
     */
    public static final String TRACELOOP_SPAN_KIND = SemanticAttributePrefixes.TRACELOOP + ".span.kind";

    public static final String TRACELOOP_ENTITY_NAME = SemanticAttributePrefixes.TRACELOOP + ".entity.name";

    /**
     * The name of the enclosing workflow, inherited by every task, agent and tool span started beneath it
     */
    public static final String TRACELOOP_WORKFLOW_NAME = SemanticAttributePrefixes.TRACELOOP + ".workflow.name";

    /**
     * Structural span kinds of an agent pipeline
     */
    public enum HierarchySpanKind {
        WORKFLOW("workflow"),
        TASK("task"),
        AGENT("agent"),
        TOOL("tool");

        private final String value;

        HierarchySpanKind(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }

    /**
     * Request types recorded under {@link #LLM_REQUEST_TYPE}
     */
    public enum LLMRequestType {
        CHAT("chat"),
        COMPLETION("completion");

        private final String value;

        LLMRequestType(String value) {
            this.value = value;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return value;
        }
    }
}
