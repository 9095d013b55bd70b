package io.github.eutro.funclets.api;

import io.github.eutro.funclets.validate.ValidatedBody;
import io.github.eutro.funclets.validate.ValidationException;
import org.jetbrains.annotations.Nullable;

/**
 * The outcome of validating one function body: the body, or why it was rejected.
 */
public final class BodyResult {
    public final int funcIndex;
    private final @Nullable ValidatedBody body;
    private final @Nullable Throwable error;

    private BodyResult(int funcIndex, @Nullable ValidatedBody body, @Nullable Throwable error) {
        this.funcIndex = funcIndex;
        this.body = body;
        this.error = error;
    }

    public static BodyResult success(ValidatedBody body) {
        return new BodyResult(body.funcIndex, body, null);
    }

    public static BodyResult failure(int funcIndex, Throwable error) {
        return new BodyResult(funcIndex, null, error);
    }

    public boolean isValid() {
        return body != null;
    }

    public @Nullable ValidatedBody getBody() {
        return body;
    }

    /**
     * Get the error the body was rejected with. This is a {@link ValidationException} for invalid bodies;
     * anything else is a bug in the validator.
     *
     * @return The error, or null if the body is valid.
     */
    public @Nullable Throwable getError() {
        return error;
    }

    public @Nullable ValidationException getValidationError() {
        return error instanceof ValidationException ? (ValidationException) error : null;
    }

    @Override
    public String toString() {
        if (body != null) return body.toString();
        assert error != null;
        return "func " + funcIndex + ": " + (error instanceof ValidationException
                ? error.getMessage()
                : "internal error: " + error);
    }
}
