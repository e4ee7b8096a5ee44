package ai.coursedoc.transcoder.render;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Big-operator characters and the LaTeX command each one is rendered as.
 */
public enum NaryOperatorSymbol {
    SUM("\u2211", "\\sum"),
    PRODUCT("\u220F", "\\prod"),
    INTEGRAL("\u222B", "\\int"),
    DOUBLE_INTEGRAL("\u222C", "\\iint"),
    TRIPLE_INTEGRAL("\u222D", "\\iiint"),
    CONTOUR_INTEGRAL("\u222E", "\\oint"),
    UNION("\u22C3", "\\bigcup"),
    INTERSECTION("\u22C2", "\\bigcap"),
    DIRECT_SUM("\u2A01", "\\bigoplus"),
    TENSOR_PRODUCT("\u2A02", "\\bigotimes");

    private static final Map<String, NaryOperatorSymbol> BY_CHARACTER = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(NaryOperatorSymbol::character, Function.identity()));

    private final String character;
    private final String command;

    NaryOperatorSymbol(String character, String command) {
        this.character = character;
        this.command = command;
    }

    public String character() {
        return character;
    }

    public String command() {
        return command;
    }

    /**
     * Resolves an operator character; unmapped characters fall back to {@link #SUM}.
     */
    public static NaryOperatorSymbol fromCharacter(String character) {
        if (character == null) {
            return SUM;
        }
        return BY_CHARACTER.getOrDefault(character, SUM);
    }
}
