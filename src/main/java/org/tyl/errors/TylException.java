package org.tyl.errors;

/**
 * Thrown when {@link TylResult#getOrThrow()} is called on a failed result.
 * Unchecked, because it signals that the caller skipped the {@link TylResult#isErr()} check.
 */
public class TylException extends RuntimeException {

    private final TylError error;

    public TylException(TylError error) {
        super(error.toString());
        this.error = error;
    }

    public TylError error() {
        return error;
    }
}
