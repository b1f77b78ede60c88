package dev.roshin.treescan.analysis.core;

/**
 * A {@link CharSequence} view that checks the file deadline while a regex engine
 * walks it. {@link java.util.regex.Matcher} cannot be interrupted, but it reads its
 * input through {@code charAt}, so a backtracking match over this view fails with
 * {@link FileTimeoutException} soon after the deadline instead of running forever.
 */
final class DeadlineCharSequence implements CharSequence {
    private static final int CHECK_INTERVAL = 4096;

    private final CharSequence delegate;
    private final FileContext context;
    private int reads;

    DeadlineCharSequence(CharSequence delegate, FileContext context) {
        this.delegate = delegate;
        this.context = context;
    }

    @Override
    public char charAt(int index) {
        if (++reads >= CHECK_INTERVAL) {
            reads = 0;
            context.checkpoint();
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return new DeadlineCharSequence(delegate.subSequence(start, end), context);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
