package org.Aayush.navigation.matching;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Regular expression compiled from a {@link PathPattern} plus its capture names in
 * group order. A trailing splat is captured under the name {@code *}.
 */
public record CompiledPath(Pattern matcher, List<String> paramNames) {
    public CompiledPath {
        Objects.requireNonNull(matcher, "matcher");
        paramNames = List.copyOf(paramNames);
    }
}
