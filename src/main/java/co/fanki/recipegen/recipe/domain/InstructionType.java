package co.fanki.recipegen.recipe.domain;

/**
 * The build recipe instructions the synthesizer emits.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum InstructionType {

    FROM,
    WORKDIR,
    ENV,
    RUN,
    COPY,
    EXPOSE,
    CMD

}
