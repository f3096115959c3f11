package fr.lapetina.resumeai.domain.exception;

import fr.lapetina.resumeai.domain.model.ClassifiedError;
import fr.lapetina.resumeai.domain.model.ErrorCode;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Terminal failure of an AI request, completing the caller's future exceptionally.
 *
 * Carries the last {@link ClassifiedError} so callers can render provider, request ID
 * and reset time. Checks should compare {@link #getCode()}, not exception types.
 */
public final class AiServiceException extends RuntimeException {

    private final ClassifiedError error;

    public AiServiceException(ClassifiedError error) {
        super(Objects.requireNonNull(error, "Classified error is required").message());
        this.error = error;
    }

    public AiServiceException(ClassifiedError error, Throwable cause) {
        super(Objects.requireNonNull(error, "Classified error is required").message(), cause);
        this.error = error;
    }

    public ClassifiedError getError() {
        return error;
    }

    public ErrorCode getCode() {
        return error.code();
    }

    public boolean isRetryable() {
        return error.retryable();
    }

    /**
     * Extracts the classified error from a future failure, unwrapping completion wrappers.
     */
    public static Optional<ClassifiedError> classifiedErrorOf(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException || current instanceof ExecutionException) {
            if (current.getCause() == null) {
                break;
            }
            current = current.getCause();
        }
        if (current instanceof AiServiceException ase) {
            return Optional.of(ase.getError());
        }
        return Optional.empty();
    }
}
