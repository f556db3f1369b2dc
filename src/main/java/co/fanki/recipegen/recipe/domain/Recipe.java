package co.fanki.recipegen.recipe.domain;

import co.fanki.recipegen.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * A container build recipe: an ordered sequence of instruction blocks.
 *
 * <p>The order of the instructions is validated on construction:</p>
 * <ul>
 *   <li>the base image ({@code FROM}) comes first;</li>
 *   <li>every {@code ENV} precedes every {@code RUN};</li>
 *   <li>the application copy ({@code COPY . .}) follows every
 *       {@code RUN} and every other {@code COPY};</li>
 *   <li>{@code EXPOSE}, when present, sits between the application copy
 *       and the run command;</li>
 *   <li>there is exactly one {@code CMD}, and it is last.</li>
 * </ul>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class Recipe {

    /** Arguments of the instruction that copies the application code. */
    static final String APPLICATION_COPY = ". .";

    private final List<RecipeBlock> blocks;

    /**
     * Creates a recipe.
     *
     * @param theBlocks the blocks in order, never empty
     * @throws IllegalArgumentException if the instruction order is invalid
     */
    public Recipe(final List<RecipeBlock> theBlocks) {
        Preconditions.requireNonNull(theBlocks, "Blocks are required");
        this.blocks = List.copyOf(theBlocks);
        validate(instructions());
    }

    public List<RecipeBlock> blocks() {
        return blocks;
    }

    /**
     * Returns all instructions, flattened in order.
     *
     * @return the instructions
     */
    public List<Instruction> instructions() {
        final List<Instruction> all = new ArrayList<>();
        for (final RecipeBlock block : blocks) {
            all.addAll(block.instructions());
        }
        return all;
    }

    /**
     * Renders the recipe text: blocks separated by one blank line,
     * {@code \n} line endings and a trailing newline.
     *
     * @return the recipe text
     */
    public String render() {
        final StringBuilder out = new StringBuilder();
        for (int i = 0; i < blocks.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            blocks.get(i).renderTo(out);
        }
        return out.toString();
    }

    private static void validate(final List<Instruction> instructions) {
        Preconditions.require(!instructions.isEmpty(),
                "A recipe needs instructions");
        Preconditions.require(instructions.get(0).type() == InstructionType.FROM,
                "A recipe must start with FROM");

        final int last = instructions.size() - 1;
        int commands = 0;
        int lastEnv = -1;
        int firstRun = Integer.MAX_VALUE;
        int lastDependencyStep = -1;
        int applicationCopy = -1;
        int expose = -1;

        for (int i = 0; i <= last; i++) {
            final Instruction instruction = instructions.get(i);
            switch (instruction.type()) {
                case CMD:
                    commands++;
                    break;
                case ENV:
                    lastEnv = i;
                    break;
                case RUN:
                    firstRun = Math.min(firstRun, i);
                    lastDependencyStep = i;
                    break;
                case COPY:
                    if (instruction.is(InstructionType.COPY, APPLICATION_COPY)) {
                        applicationCopy = i;
                    } else {
                        lastDependencyStep = i;
                    }
                    break;
                case EXPOSE:
                    expose = i;
                    break;
                default:
                    break;
            }
        }

        Preconditions.require(commands == 1
                && instructions.get(last).type() == InstructionType.CMD,
                "A recipe must end with its only CMD");
        Preconditions.require(lastEnv < firstRun,
                "ENV instructions must precede RUN instructions");
        Preconditions.require(applicationCopy > lastDependencyStep,
                "The application copy must follow dependency installation");
        Preconditions.require(expose < 0
                || (expose > applicationCopy && expose < last),
                "EXPOSE must follow the application copy");
    }

}
