package ai.coursedoc.transcoder.model;

import java.util.Optional;

/**
 * Big operator (sum, product, integral, union, ...) with optional limits.
 *
 * <p>An absent operator character stands for the summation sign.
 */
public record NAryOperator(
        Optional<String> operatorChar,
        Optional<MathNode> lowerLimit,
        Optional<MathNode> upperLimit,
        MathNode operand
) implements MathNode {

    public NAryOperator {
        operatorChar = operatorChar == null ? Optional.empty() : operatorChar;
        lowerLimit = lowerLimit == null ? Optional.empty() : lowerLimit;
        upperLimit = upperLimit == null ? Optional.empty() : upperLimit;
        operand = Group.orEmpty(operand);
    }

    @Override
    public <R> R accept(MathNodeVisitor<R> visitor) {
        return visitor.visitNAryOperator(this);
    }
}
