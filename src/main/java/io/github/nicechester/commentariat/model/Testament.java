package io.github.nicechester.commentariat.model;

/**
 * Testament a canonical book belongs to.
 */
public enum Testament {
    OLD,
    NEW
}
