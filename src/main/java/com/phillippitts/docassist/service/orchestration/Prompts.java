package com.phillippitts.docassist.service.orchestration;

import com.phillippitts.docassist.domain.ExtractedContent;

/**
 * Prompt text sent to the model server, plus context truncation for long documents.
 */
final class Prompts {

    static final int MAX_CONTEXT_CHARS = 50_000;
    static final String TRUNCATION_MARKER = "\n\n[...content truncated...]\n\n";

    static final String SUMMARY_SYSTEM =
            "You summarise documents factually. Reply with bullet points only, one per line, starting with \"-\".";
    static final String INDEX_SYSTEM =
            "You extract the key facts of a document for later search. Reply with short bullet points only.";
    static final String LOOKUP_SYSTEM = "You are a concise dictionary. Answer in 15 words or fewer.";
    static final String ANSWER_NO_CONTEXT = "You are a helpful assistant. Be concise.";

    private Prompts() {
    }

    static String summaryRequest(ExtractedContent content) {
        return header(content) + content.text() + "\n\nSummarise the document above in 3 to 5 bullet points.";
    }

    static String indexRequest(ExtractedContent content) {
        return header(content) + content.text() + "\n\nList the key facts of the document above as bullet points.";
    }

    static String lookupRequest(String term) {
        return "Define \"" + term + "\" briefly.";
    }

    static String answerSystem(String context) {
        if (context == null || context.isBlank()) {
            return ANSWER_NO_CONTEXT;
        }
        return "You help the user understand a document.\n\nDOCUMENT:\n" + truncate(context)
                + "\n\nAnswer only from the document above. If the answer is not in it, say so. "
                + "Keep answers to two or three sentences unless more is needed.";
    }

    /**
     * Keeps the first 60% and last 40% of {@link #MAX_CONTEXT_CHARS} with a marker between them.
     */
    static String truncate(String context) {
        if (context.length() <= MAX_CONTEXT_CHARS) {
            return context;
        }
        int head = (int) Math.floor(MAX_CONTEXT_CHARS * 0.6);
        int tail = MAX_CONTEXT_CHARS - head;
        return context.substring(0, head) + TRUNCATION_MARKER + context.substring(context.length() - tail);
    }

    private static String header(ExtractedContent content) {
        StringBuilder sb = new StringBuilder();
        if (!content.title().isBlank()) {
            sb.append("Title: ").append(content.title()).append('\n');
        }
        sb.append("---\n");
        return sb.toString();
    }
}
