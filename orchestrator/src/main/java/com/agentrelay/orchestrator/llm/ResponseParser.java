package com.agentrelay.orchestrator.llm;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the structured answer out of a model reply.
 *
 * Agents are prompted to wrap their answer in {@code <result>...</result>};
 * models sometimes use a fenced JSON block instead, or bare JSON.
 */
public final class ResponseParser {

    // <result>...</result>
    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    // ```json ... ``` or ``` ... ```
    private static final Pattern JSON_FENCE = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n\\s*```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    /** Content of the first {@code <result>} tag. */
    public static Optional<String> extractResult(String response) {
        if (response == null) return Optional.empty();
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** Content of the first fenced block, with or without a {@code json} label. */
    public static Optional<String> extractFencedBlock(String response) {
        if (response == null) return Optional.empty();
        Matcher m = JSON_FENCE.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /**
     * Best-effort JSON object text: the result tag, else a fenced block, else
     * the span from the first '{' to the last '}'.
     */
    public static Optional<String> extractJsonObject(String response) {
        if (response == null) return Optional.empty();
        String candidate = extractResult(response)
                .or(() -> extractFencedBlock(response))
                .orElse(response);
        Optional<String> fenced = extractFencedBlock(candidate);
        if (fenced.isPresent()) candidate = fenced.get();

        int start = candidate.indexOf('{');
        int end   = candidate.lastIndexOf('}');
        return start >= 0 && end > start
                ? Optional.of(candidate.substring(start, end + 1))
                : Optional.empty();
    }
}
