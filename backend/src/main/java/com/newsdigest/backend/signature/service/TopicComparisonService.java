package com.newsdigest.backend.signature.service;

import com.newsdigest.backend.ai.service.ApiUsageMonitoringService;
import com.newsdigest.backend.candidate.entity.CandidateItem;
import com.newsdigest.backend.exception.ComparisonResponseParseException;
import com.newsdigest.backend.exception.ComparisonServiceUnavailableException;
import com.newsdigest.backend.exception.TransientExternalException;
import com.newsdigest.backend.signature.dto.TopicComparisonResult;
import com.newsdigest.backend.signature.entity.TopicSignature;
import io.github.resilience4j.retry.Retry;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.stereotype.Service;

/**
 * Asks the chat model whether a candidate covers the same story as one of the day's signatures.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopicComparisonService {

    private static final String SYSTEM_PROMPT = """
            You are a news editor removing repeat coverage from a daily digest.
            Decide whether the NEW ARTICLE reports the same story as one of the PUBLISHED TOPICS.
            Follow-ups with materially new facts count as a different story.
            Answer with JSON only, in exactly this format:
            {"sameTopic": true or false, "matchedSignatureId": "<id of the matching topic or null>", "confidence": <0.0 to 1.0>}
            """;

    private static final String USER_PROMPT = """
            NEW ARTICLE
            Title: %s
            Summary: %s

            PUBLISHED TOPICS
            %s
            """;

    private static final int ITEM_EXCERPT_LENGTH = 1500;

    private final ChatModel chatModel;
    private final TopicComparisonResponseParser responseParser;
    private final ApiUsageMonitoringService usageMonitoringService;
    private final Retry topicComparisonRetry;

    /**
     * Compare one candidate against a window of signatures. Transient failures are retried with
     * backoff; what escapes is either a {@link TransientExternalException} (retries spent), a
     * {@link ComparisonResponseParseException} or a {@link ComparisonServiceUnavailableException}.
     */
    public TopicComparisonResult compare(CandidateItem item, List<TopicSignature> window) {
        Set<String> windowIds = window.stream()
                .map(TopicSignature::getSignatureId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Prompt prompt = new Prompt(List.of(
                new SystemMessage(SYSTEM_PROMPT),
                new UserMessage(String.format(USER_PROMPT, item.getTitle(), excerpt(item), describe(window)))));
        int tokenCount = ApiUsageMonitoringService.estimateTokenCount(SYSTEM_PROMPT)
                + ApiUsageMonitoringService.estimateTokenCount(prompt.getContents());

        String aiResponse;
        try {
            aiResponse = Retry.decorateSupplier(topicComparisonRetry, () -> call(prompt)).get();
        } catch (RuntimeException e) {
            usageMonitoringService.logApiUsage(ApiUsageMonitoringService.TOPIC_COMPARISON, item.getId(), tokenCount, false, e.getMessage());
            throw e;
        }

        try {
            TopicComparisonResult result = responseParser.parse(aiResponse, windowIds);
            usageMonitoringService.logApiUsage(ApiUsageMonitoringService.TOPIC_COMPARISON, item.getId(), tokenCount, true, null);
            log.debug("🤖 Item {} judged {} (signature {}, confidence {})",
                    item.getId(), result.getVerdict(), result.getMatchedSignatureId(), result.getConfidence());
            return result;
        } catch (ComparisonResponseParseException e) {
            usageMonitoringService.logApiUsage(ApiUsageMonitoringService.TOPIC_COMPARISON, item.getId(), tokenCount, false, e.getMessage());
            throw e;
        }
    }

    private String call(Prompt prompt) {
        try {
            ChatResponse response = chatModel.call(prompt);
            if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
                throw new TransientExternalException("Comparison service returned no result");
            }
            String text = response.getResult().getOutput().getText();
            return text != null ? text.trim() : "";
        } catch (TransientExternalException e) {
            throw e;
        } catch (RuntimeException e) {
            if (isUnreachable(e)) {
                throw new ComparisonServiceUnavailableException("Comparison service unreachable: " + e.getMessage(), e);
            }
            throw new TransientExternalException("Comparison call failed: " + e.getMessage(), e);
        }
    }

    private static boolean isUnreachable(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConnectException || cause instanceof UnknownHostException) {
                return true;
            }
            if (cause.getCause() == cause) {
                break;
            }
        }
        return false;
    }

    private static String describe(List<TopicSignature> window) {
        return window.stream()
                .map(s -> String.format("- id: %s | theme: %s | summary: %s",
                        s.getSignatureId(), s.getThemeLabel(), s.getSummaryExcerpt()))
                .collect(Collectors.joining("\n"));
    }

    private static String excerpt(CandidateItem item) {
        String text = item.getContentDigest() != null ? item.getContentDigest() : "";
        return text.length() > ITEM_EXCERPT_LENGTH ? text.substring(0, ITEM_EXCERPT_LENGTH) : text;
    }
}
