package com.fundermatch.matching.ai;

/**
 * External language-model scoring service. Implementations return the text content of the
 * model's reply, or null when the reply carried no text.
 */
public interface ScoringClient {
    String score(String systemPrompt, String userPrompt);
}
