package com.adlanda.authorityindexer.service.embedding;

import com.adlanda.authorityindexer.config.EmbeddingProperties;
import com.adlanda.authorityindexer.exception.EmbeddingProviderException;
import com.adlanda.authorityindexer.exception.RateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingRequest;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Embedding provider backed by Spring AI's EmbeddingModel (OpenAI text-embedding-3-small).
 *
 * Spring AI's own retry is disabled in configuration; provider failures are
 * classified here and retried by the orchestrator.
 */
@Component
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private static final String ENCODING_FORMAT = "float";

    // Spring AI reports HTTP errors as "<status> - <body>"; only the status prefix is trusted
    private static final Pattern RATE_LIMITED = Pattern.compile("^429 - ");

    private final EmbeddingModel embeddingModel;
    private final String model;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel, EmbeddingProperties properties) {
        this.embeddingModel = embeddingModel;
        this.model = properties.getModel();
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        EmbeddingRequest request = new EmbeddingRequest(texts, OpenAiEmbeddingOptions.builder()
                .model(model)
                .encodingFormat(ENCODING_FORMAT)
                .build());

        EmbeddingResponse response;
        try {
            response = embeddingModel.call(request);
        } catch (RuntimeException e) {
            if (isRateLimited(e)) {
                throw new RateLimitedException("Embedding provider rate limited the request: " + e.getMessage(), e);
            }
            log.error("API error during embedding of {} texts: {}", texts.size(), e.getMessage());
            throw new EmbeddingProviderException("Embedding request failed: " + e.getMessage(), e);
        }

        if (response == null || response.getResults() == null) {
            throw new EmbeddingProviderException("Embedding provider returned no results");
        }
        return response.getResults().stream()
                .map(Embedding::getOutput)
                .toList();
    }

    @Override
    public String modelId() {
        return model;
    }

    /**
     * Looks through the cause chain for an HTTP 429 status, either as an exception
     * status code or as the "429 - " prefix of a Spring AI error message.
     */
    static boolean isRateLimited(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpStatusCodeException httpError
                    && httpError.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && RATE_LIMITED.matcher(message.strip()).lookingAt()) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
