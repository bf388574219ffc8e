package dev.sfc.engine;

import dev.sfc.model.Step;
import dev.sfc.model.Transition;

import java.util.Collection;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lookup of steps and transitions by the number embedded in their operand
 * label ({@code "Step_008"} is operand number 8).
 *
 * <p>Operand numbers need not be unique; a lookup returns the first match in
 * registration order.
 */
public final class OperandIndex {

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final Collection<Step> steps;
    private final Collection<Transition> transitions;

    public OperandIndex(Collection<Step> steps, Collection<Transition> transitions) {
        this.steps = steps;
        this.transitions = transitions;
    }

    /**
     * The first run of decimal digits in {@code operand}, or null when there is
     * none or it does not fit in an int.
     */
    public static Integer parse(String operand) {
        if (operand == null) {
            return null;
        }
        Matcher matcher = DIGITS.matcher(operand);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public Optional<Step> stepByOperand(int number) {
        return first(steps, Step::operandNumber, number);
    }

    /**
     * Same as {@link #stepByOperand(int)} for a number given as text, e.g. {@code "8"}.
     */
    public Optional<Step> stepByOperand(String number) {
        Integer value = parseRequest(number);
        return value == null ? Optional.empty() : stepByOperand(value);
    }

    public Optional<Transition> transitionByOperand(int number) {
        return first(transitions, Transition::operandNumber, number);
    }

    public Optional<Transition> transitionByOperand(String number) {
        Integer value = parseRequest(number);
        return value == null ? Optional.empty() : transitionByOperand(value);
    }

    private static <T> Optional<T> first(Collection<T> nodes, Function<T, Integer> operandNumber, int number) {
        for (T node : nodes) {
            Integer candidate = operandNumber.apply(node);
            if (candidate != null && candidate == number) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    private static Integer parseRequest(String number) {
        if (number == null) {
            return null;
        }
        try {
            return Integer.parseInt(number.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
