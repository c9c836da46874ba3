package ai.diffscope.server.http;

import org.jetbrains.annotations.Nullable;

/**
 * Body of every non-2xx JSON response.
 *
 * @param code machine-readable error code, one of {@link Code}
 * @param details extra context such as the underlying exception; null when there is none
 */
public record ErrorPayload(String code, String message, @Nullable String details) {

    public ErrorPayload {
        if (code.isBlank()) {
            throw new IllegalArgumentException("code must not be blank");
        }
        if (message.isBlank()) {
            throw new IllegalArgumentException("message must not be blank");
        }
    }

    public static class Code {
        public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
        public static final String DIFF_FAILED = "DIFF_FAILED";
        public static final String NOT_FOUND = "NOT_FOUND";
        public static final String FILE_TOO_LARGE = "FILE_TOO_LARGE";
        public static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
        public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

        private Code() {}
    }

    public static ErrorPayload of(String code, String message) {
        return new ErrorPayload(code, message, null);
    }

    public static ErrorPayload validationError(String message) {
        return of(Code.VALIDATION_ERROR, message);
    }

    public static ErrorPayload internalError(String message, Throwable throwable) {
        return new ErrorPayload(
                Code.INTERNAL_ERROR, message, throwable.getClass().getSimpleName() + ": " + throwable.getMessage());
    }
}
