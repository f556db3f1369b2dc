package co.fanki.recipegen.recipe.domain;

import co.fanki.recipegen.shared.Preconditions;

import java.util.List;

/**
 * One build recipe instruction, e.g. {@code WORKDIR /app}.
 *
 * @param type the instruction keyword
 * @param arguments the text after the keyword; may span several lines
 *     joined with backslash continuations
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Instruction(InstructionType type, String arguments) {

    public Instruction {
        Preconditions.requireNonNull(type, "Instruction type is required");
        Preconditions.requireNonBlank(arguments,
                "Instruction arguments are required");
    }

    public static Instruction of(final InstructionType type,
            final String arguments) {
        return new Instruction(type, arguments);
    }

    /**
     * Creates an exec-form instruction, {@code CMD ["a", "b"]}.
     *
     * @param type the instruction keyword
     * @param command the command arguments, never empty
     * @return the instruction
     */
    public static Instruction execForm(final InstructionType type,
            final List<String> command) {
        Preconditions.require(!command.isEmpty(), "Command cannot be empty");
        final StringBuilder json = new StringBuilder("[");
        for (int i = 0; i < command.size(); i++) {
            if (i > 0) {
                json.append(", ");
            }
            json.append('"').append(command.get(i).replace("\\", "\\\\")
                    .replace("\"", "\\\"")).append('"');
        }
        return new Instruction(type, json.append(']').toString());
    }

    /**
     * Checks whether this is the given instruction with the given
     * arguments.
     *
     * @param theType the keyword
     * @param theArguments the arguments
     * @return true on an exact match
     */
    public boolean is(final InstructionType theType,
            final String theArguments) {
        return type == theType && arguments.equals(theArguments);
    }

    /**
     * Renders the instruction as recipe text, without a line terminator.
     *
     * @return the instruction line(s)
     */
    public String render() {
        return type.name() + " " + arguments;
    }

}
