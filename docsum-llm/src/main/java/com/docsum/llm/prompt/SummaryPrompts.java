package com.docsum.llm.prompt;

import java.util.List;

public final class SummaryPrompts {

    public static final String SUMMARY_SEPARATOR = "\n\n---\n\n";

    public static final String MAP_SYSTEM = """
        You are a document summarizer. Summarize the following section of a document.
        Focus on key points, main ideas, and important details.
        Keep the summary concise but informative.""";

    public static final String REDUCE_SYSTEM = """
        You are a document summarizer. You are given summaries of different sections from a single document.
        Combine these into one coherent, well-structured summary.
        Use markdown formatting for better readability.
        Highlight the most important points and maintain logical flow.""";

    private SummaryPrompts() {}

    public static String summarizeSection(String sectionText) {
        return "Summarize this section:\n\n" + sectionText;
    }

    /**
     * Section summaries are concatenated in document order.
     */
    public static String combineSummaries(List<String> summaries) {
        return "Combine these section summaries into a final summary:\n\n"
            + String.join(SUMMARY_SEPARATOR, summaries);
    }
}
