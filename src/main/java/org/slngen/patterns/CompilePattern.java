package org.slngen.patterns;

import java.util.List;

/**
 * One compile rule of a descriptor: an include glob and the globs carved out of it.
 *
 * @param include The include glob, e.g. {@code Assets/Game/**&#47;*.cs}.
 * @param exclude Exclude globs below the include directory, in first-seen order without repeats.
 */
public record CompilePattern(String include, List<String> exclude) {

    public CompilePattern {
        exclude = List.copyOf(exclude);
    }

    public static CompilePattern of(String include) {
        return new CompilePattern(include, List.of());
    }
}
