package site.rstream.utils;

/**
 * Redis风格的glob匹配，支持 {@code *}、{@code ?}、{@code [...]}（含 {@code ^} 取反与 {@code a-z} 区间）
 * 以及 {@code \} 转义。
 *
 * <p>按字节匹配，与Redis的 stringmatchlen 行为一致，不做字符集解码。
 */
public final class GlobPattern {

    private final byte[] pattern;

    private final boolean ignoreCase;

    private GlobPattern(final byte[] pattern, final boolean ignoreCase) {
        this.pattern = pattern;
        this.ignoreCase = ignoreCase;
    }

    public static GlobPattern compile(final byte[] pattern) {
        return new GlobPattern(pattern, false);
    }

    public static GlobPattern compileIgnoreCase(final byte[] pattern) {
        return new GlobPattern(pattern, true);
    }

    /** {@code *} 可以直接跳过逐个匹配 */
    public boolean matchesAll() {
        return pattern.length == 1 && pattern[0] == '*';
    }

    public boolean matches(final byte[] text) {
        return match(0, text, 0);
    }

    private boolean match(int p, final byte[] text, int t) {
        while (p < pattern.length) {
            final byte c = pattern[p];
            switch (c) {
                case '*':
                    while (p + 1 < pattern.length && pattern[p + 1] == '*') {
                        p++;
                    }
                    if (p + 1 == pattern.length) {
                        return true;
                    }
                    for (int i = t; i <= text.length; i++) {
                        if (match(p + 1, text, i)) {
                            return true;
                        }
                    }
                    return false;
                case '?':
                    if (t >= text.length) {
                        return false;
                    }
                    t++;
                    p++;
                    break;
                case '[': {
                    if (t >= text.length) {
                        return false;
                    }
                    p++;
                    final boolean not = p < pattern.length && pattern[p] == '^';
                    if (not) {
                        p++;
                    }
                    boolean matched = false;
                    while (p < pattern.length && pattern[p] != ']') {
                        if (pattern[p] == '\\' && p + 1 < pattern.length) {
                            p++;
                            matched |= equalsByte(pattern[p], text[t]);
                        } else if (p + 2 < pattern.length && pattern[p + 1] == '-' && pattern[p + 2] != ']') {
                            int start = fold(pattern[p]);
                            int end = fold(pattern[p + 2]);
                            if (start > end) {
                                final int tmp = start;
                                start = end;
                                end = tmp;
                            }
                            final int ch = fold(text[t]);
                            matched |= ch >= start && ch <= end;
                            p += 2;
                        } else {
                            matched |= equalsByte(pattern[p], text[t]);
                        }
                        p++;
                    }
                    // 未闭合的 '[' 视为到结尾
                    if (p < pattern.length) {
                        p++;
                    }
                    if (not == matched) {
                        return false;
                    }
                    t++;
                    break;
                }
                case '\\':
                    if (p + 1 < pattern.length) {
                        p++;
                    }
                    // fall through
                default:
                    if (t >= text.length || !equalsByte(pattern[p], text[t])) {
                        return false;
                    }
                    t++;
                    p++;
                    break;
            }
        }
        return t == text.length;
    }

    private boolean equalsByte(final byte a, final byte b) {
        return fold(a) == fold(b);
    }

    private int fold(final byte b) {
        final int v = b & 0xFF;
        if (ignoreCase && v >= 'A' && v <= 'Z') {
            return v + 32;
        }
        return v;
    }
}
