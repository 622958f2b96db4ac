package com.poc.salesingest.service.ai;

/**
 * Text generation capability used for header detection, sales classification and summaries.
 */
public interface GenerativeModelClient {

    /**
     * @return false when no credentials are configured; callers skip the model entirely then.
     */
    boolean isConfigured();

    /**
     * Sends one prompt and returns the concatenated, trimmed text of the answer (possibly empty).
     */
    String generate(String prompt) throws ModelClientException;
}
