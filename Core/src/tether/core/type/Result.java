package tether.core.type;

import tether.core.util.ObjectChecker;

/**
 * The outcome of parsing or resolving something supplied by a user: either the resulting data or a message saying
 * what was wrong with the input. Exactly one of the two is non-null.
 */
public final class Result<D> {
    private final D data;
    private final String error;

    private Result(D data, String error) {
        this.data = data;
        this.error = error;
    }

    public static <D> Result<D> successful(D data) {
        ObjectChecker.assertNonNull(data);
        return new Result<>(data, null);
    }

    public static <D> Result<D> error(String error) {
        ObjectChecker.assertNonEmpty(error);
        return new Result<>(null, error);
    }

    /**
     * Returns this failed result as a result of another type, carrying the same error.
     *
     * @return the same error as a result of the requested type.
     * @throws IllegalStateException If this result is successful.
     */
    public <T> Result<T> propagateError() {
        if (isSuccess()) {
            throw new IllegalStateException("cannot propagate the error of a successful result.");
        }
        return new Result<>(null, this.error);
    }

    public boolean isSuccess() {
        return this.error == null;
    }

    /**
     * Returns the data, or null if this result is an error.
     */
    public D getData() {
        return this.data;
    }

    /**
     * Returns the error message, or null if this result is successful.
     */
    public String getError() {
        return this.error;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? this.getClass().getSimpleName() + " { data: " + this.data + " }"
                : this.getClass().getSimpleName() + " { error: " + this.error + " }";
    }
}
