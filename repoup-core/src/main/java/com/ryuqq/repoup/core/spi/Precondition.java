package com.ryuqq.repoup.core.spi;

/**
 * Precondition attached to a conditional put.
 *
 * <ul>
 *   <li>{@link None}: unconditional write</li>
 *   <li>{@link IfAbsent}: succeeds only if the object does not currently exist</li>
 *   <li>{@link IfMatch}: succeeds only if the current version token equals the given one</li>
 * </ul>
 *
 * @author Repoup Team
 * @since 1.0.0
 */
public sealed interface Precondition permits Precondition.None, Precondition.IfAbsent, Precondition.IfMatch {

    static Precondition none() {
        return None.INSTANCE;
    }

    static Precondition ifAbsent() {
        return IfAbsent.INSTANCE;
    }

    static Precondition ifMatch(VersionToken token) {
        return new IfMatch(token);
    }

    /**
     * "if absent" when no token was observed, "if match" otherwise.
     *
     * @param observed token read earlier, or null if the object did not exist
     * @return matching precondition
     */
    static Precondition expecting(VersionToken observed) {
        return observed == null ? ifAbsent() : ifMatch(observed);
    }

    /**
     * Checks the precondition against the current token of an object.
     *
     * @param current current token, or null if the object does not exist
     * @return true if a write may proceed
     */
    boolean isSatisfiedBy(VersionToken current);

    /** Unconditional write. */
    enum None implements Precondition {
        INSTANCE;

        @Override
        public boolean isSatisfiedBy(VersionToken current) {
            return true;
        }
    }

    /** Object must not exist. */
    enum IfAbsent implements Precondition {
        INSTANCE;

        @Override
        public boolean isSatisfiedBy(VersionToken current) {
            return current == null;
        }
    }

    /**
     * Object must exist with the given version.
     *
     * @param expected expected version token
     */
    record IfMatch(VersionToken expected) implements Precondition {

        public IfMatch {
            if (expected == null) {
                throw new IllegalArgumentException("expected cannot be null");
            }
        }

        @Override
        public boolean isSatisfiedBy(VersionToken current) {
            return expected.equals(current);
        }
    }
}
