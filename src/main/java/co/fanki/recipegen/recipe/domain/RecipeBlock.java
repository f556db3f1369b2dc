package co.fanki.recipegen.recipe.domain;

import co.fanki.recipegen.shared.Preconditions;

import java.util.List;

/**
 * A group of instructions preceded by explanatory comment lines.
 *
 * @param comments the comment lines, without the leading {@code # }
 * @param instructions the instructions, never empty
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RecipeBlock(List<String> comments,
        List<Instruction> instructions) {

    public RecipeBlock {
        Preconditions.requireNonNull(comments, "Comments are required");
        Preconditions.requireNonNull(instructions, "Instructions are required");
        Preconditions.require(!instructions.isEmpty(),
                "A block needs at least one instruction");
        comments = List.copyOf(comments);
        instructions = List.copyOf(instructions);
    }

    /**
     * Creates a block with a single comment line.
     *
     * @param comment the comment, without the leading {@code # }
     * @param instructions the instructions
     * @return the block
     */
    public static RecipeBlock of(final String comment,
            final Instruction... instructions) {
        return new RecipeBlock(List.of(comment), List.of(instructions));
    }

    void renderTo(final StringBuilder out) {
        for (final String comment : comments) {
            out.append("# ").append(comment).append('\n');
        }
        for (final Instruction instruction : instructions) {
            out.append(instruction.render()).append('\n');
        }
    }

}
