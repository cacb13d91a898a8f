package me.golemcore.reasoning.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.reasoning.port.outbound.InferenceErrorKind;
import me.golemcore.reasoning.port.outbound.InferenceException;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Maps provider failures to stable diagnostic codes and then to
 * {@link InferenceErrorKind}.
 *
 * <p>
 * LangChain4j exceptions are matched by class name so the classifier keeps
 * working when a provider module is absent from the classpath.
 */
public final class InferenceErrorClassifier {

    public static final String REQUEST_ABORTED = "inference.request.aborted";
    public static final String REQUEST_TIMEOUT = "inference.request.timeout";
    public static final String CONTEXT_LENGTH_EXCEEDED = "inference.context.length_exceeded";
    public static final String INVALID_RESPONSE = "inference.response.invalid";
    public static final String RATE_LIMIT = "inference.langchain4j.rate_limit";
    public static final String TIMEOUT = "inference.langchain4j.timeout";
    public static final String AUTHENTICATION = "inference.langchain4j.authentication";
    public static final String INVALID_REQUEST = "inference.langchain4j.invalid_request";
    public static final String MODEL_NOT_FOUND = "inference.langchain4j.model_not_found";
    public static final String CONTENT_FILTERED = "inference.langchain4j.content_filtered";
    public static final String INTERNAL_SERVER = "inference.langchain4j.internal_server";
    public static final String RETRIABLE = "inference.langchain4j.retriable";
    public static final String NON_RETRIABLE = "inference.langchain4j.non_retriable";
    public static final String HTTP_ERROR = "inference.langchain4j.http_error";
    public static final String UNKNOWN = "inference.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";

    private InferenceErrorClassifier() {
    }

    /**
     * Wraps any provider failure into a typed {@link InferenceException}.
     */
    public static InferenceException toInferenceException(Throwable throwable) {
        if (throwable instanceof InferenceException inferenceException) {
            return inferenceException;
        }
        String code = classifyFromThrowable(throwable);
        String message = throwable != null && throwable.getMessage() != null ? throwable.getMessage()
                : "provider call failed";
        return new InferenceException(kindFor(code), withCode(code, message), throwable);
    }

    public static InferenceErrorKind kindFor(String code) {
        if (RATE_LIMIT.equals(code)) {
            return InferenceErrorKind.RATE_LIMITED;
        }
        if (AUTHENTICATION.equals(code)) {
            return InferenceErrorKind.UNAUTHORIZED;
        }
        if (isTransientCode(code)) {
            return InferenceErrorKind.TRANSIENT;
        }
        return InferenceErrorKind.INVALID_RESPONSE;
    }

    /**
     * Classifies a failure by walking its cause chain.
     */
    public static String classifyFromThrowable(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String embedded = extractCode(current.getMessage());
            if (embedded != null && !embedded.isBlank()) {
                return embedded;
            }

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[inference.some.code] details".
     */
    public static String extractCode(String message) {
        if (message == null || message.isBlank() || message.charAt(0) != '[') {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= 1) {
            return null;
        }
        return message.substring(1, end);
    }

    public static boolean isTransientCode(String code) {
        if (code == null || code.isBlank()) {
            return false;
        }
        return RATE_LIMIT.equals(code)
                || TIMEOUT.equals(code)
                || INTERNAL_SERVER.equals(code)
                || REQUEST_TIMEOUT.equals(code)
                || RETRIABLE.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        return switch (className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length())) {
        case "RateLimitException" -> RATE_LIMIT;
        case "TimeoutException" -> TIMEOUT;
        case "AuthenticationException" -> AUTHENTICATION;
        case "InvalidRequestException" -> INVALID_REQUEST;
        case "ModelNotFoundException" -> MODEL_NOT_FOUND;
        case "ContentFilteredException" -> CONTENT_FILTERED;
        case "InternalServerException" -> INTERNAL_SERVER;
        case "HttpException" -> classifyHttpExceptionByStatus(throwable);
        case "RetriableException" -> RETRIABLE;
        case "NonRetriableException" -> NON_RETRIABLE;
        default -> UNKNOWN;
        };
    }

    static String classifyHttpStatus(int statusCode) {
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return TIMEOUT;
        }
        if (statusCode >= 500) {
            return INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return HTTP_ERROR;
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        return statusCode == null ? HTTP_ERROR : classifyHttpStatus(statusCode);
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }

        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("context length")
                || normalized.contains("context window")
                || normalized.contains("maximum context")
                || normalized.contains("prompt is too long")) {
            return CONTEXT_LENGTH_EXCEEDED;
        }
        return UNKNOWN;
    }
}
