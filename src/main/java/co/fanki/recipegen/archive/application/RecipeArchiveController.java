package co.fanki.recipegen.archive.application;

import co.fanki.recipegen.archive.domain.ArchiveStatistics;
import co.fanki.recipegen.archive.domain.DuplicateRecordException;
import co.fanki.recipegen.archive.domain.RecipeRecord;
import co.fanki.recipegen.archive.domain.RecordValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * REST controller over the recipe archive.
 *
 * <p>Dates in paths use the ISO format, {@code yyyy-MM-dd}; anything else
 * is answered with 400.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@RestController
@RequestMapping("/api/recipes")
@Tag(name = "Recipe Archive", description = "Store and query generated build recipes")
public class RecipeArchiveController {

    private static final Logger LOG = LoggerFactory.getLogger(
            RecipeArchiveController.class);

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS");

    private final RecipeArchiveService archiveService;

    /**
     * Creates a new RecipeArchiveController.
     *
     * @param theArchiveService the archive service
     */
    public RecipeArchiveController(final RecipeArchiveService theArchiveService) {
        this.archiveService = theArchiveService;
    }

    /**
     * Lists every archived recipe, newest first.
     *
     * @return the recipes
     */
    @Operation(summary = "List all recipes", description = "Returns every archived recipe, newest first.")
    @GetMapping
    public ResponseEntity<RecipeListResponse> listRecipes() {
        return ResponseEntity.ok(RecipeListResponse.of(archiveService.findAll()));
    }

    /**
     * Returns counts over the archive.
     *
     * @return the statistics
     */
    @Operation(summary = "Archive statistics", description = "Total recipes, distinct dates and distinct names.")
    @GetMapping("/stats")
    public ResponseEntity<ArchiveStatistics> statistics() {
        return ResponseEntity.ok(archiveService.statistics());
    }

    /**
     * Lists the dates that have recipes, newest first.
     *
     * @return the dates
     */
    @Operation(summary = "List dates", description = "Distinct creation dates, newest first.")
    @GetMapping("/dates")
    public ResponseEntity<DatesResponse> listDates() {
        final List<String> dates = archiveService.findDates().stream()
                .map(LocalDate::toString)
                .toList();
        return ResponseEntity.ok(new DatesResponse(dates.size(), dates));
    }

    /**
     * Returns a recipe by id.
     *
     * @param id the record id
     * @return the recipe, or 404
     */
    @Operation(summary = "Get recipe by id")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recipe found",
                    content = @Content(schema = @Schema(implementation = RecipeResponse.class))),
            @ApiResponse(responseCode = "404", description = "Recipe not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<RecipeResponse> getRecipe(
            @PathVariable("id") final long id) {
        return archiveService.findById(id)
                .map(RecipeResponse::of)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Lists the recipes created on a date, in creation order.
     *
     * @param date the ISO date
     * @return the recipes of that date
     */
    @Operation(summary = "List recipes of a date", description = "Recipes created on the date, oldest first.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recipes of the date"),
            @ApiResponse(responseCode = "400", description = "Invalid date")
    })
    @GetMapping("/by-date/{date}")
    public ResponseEntity<RecipeListResponse> listByDate(
            @PathVariable("date") final String date) {
        return ResponseEntity.ok(RecipeListResponse.of(
                archiveService.findByDate(parseDate(date))));
    }

    /**
     * Lists the distinct recipe names of a date.
     *
     * @param date the ISO date
     * @return the names
     */
    @Operation(summary = "List names of a date")
    @GetMapping("/by-date/{date}/names")
    public ResponseEntity<NamesResponse> listNames(
            @PathVariable("date") final String date) {
        final LocalDate day = parseDate(date);
        final List<String> names = archiveService.findNames(day);
        return ResponseEntity.ok(new NamesResponse(day.toString(),
                names.size(), names));
    }

    /**
     * Returns the newest recipe with a name on a date.
     *
     * @param date the ISO date
     * @param name the recipe name
     * @return the recipe, or 404
     */
    @Operation(summary = "Get latest recipe by date and name")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recipe found",
                    content = @Content(schema = @Schema(implementation = RecipeResponse.class))),
            @ApiResponse(responseCode = "400", description = "Invalid date"),
            @ApiResponse(responseCode = "404", description = "Recipe not found")
    })
    @GetMapping("/by-date/{date}/{name}")
    public ResponseEntity<RecipeResponse> getLatest(
            @PathVariable("date") final String date,
            @PathVariable("name") final String name) {
        return archiveService.findLatest(parseDate(date), name)
                .map(RecipeResponse::of)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Returns the raw text of the newest recipe with a name on a date.
     *
     * @param date the ISO date
     * @param name the recipe name
     * @return the recipe text, or 404
     */
    @Operation(summary = "Get latest recipe content", description = "The recipe text as text/plain.")
    @GetMapping(value = "/by-date/{date}/{name}/content",
            produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getLatestContent(
            @PathVariable("date") final String date,
            @PathVariable("name") final String name) {
        return archiveService.findLatest(parseDate(date), name)
                .map(RecipeRecord::content)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Archives a recipe.
     *
     * @param request the name and content
     * @return the stored recipe with 201
     */
    @Operation(summary = "Archive a recipe", description = "Stores the recipe stamped with the current date and time.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Recipe archived",
                    content = @Content(schema = @Schema(implementation = RecipeResponse.class))),
            @ApiResponse(responseCode = "409", description = "Same name already archived at that date and time"),
            @ApiResponse(responseCode = "422", description = "Empty name or missing content")
    })
    @PostMapping
    public ResponseEntity<RecipeResponse> createRecipe(
            @RequestBody final CreateRecipeRequest request) {

        LOG.info("Received archive request for: {}", request.name());

        final RecipeRecord stored = archiveService.create(request.name(),
                request.content());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(RecipeResponse.of(stored));
    }

    /**
     * Deletes a recipe.
     *
     * @param id the record id
     * @return the deletion result, or 404
     */
    @Operation(summary = "Delete a recipe")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Recipe deleted"),
            @ApiResponse(responseCode = "404", description = "Recipe not found")
    })
    @DeleteMapping("/{id}")
    public ResponseEntity<DeleteResponse> deleteRecipe(
            @PathVariable("id") final long id) {
        if (!archiveService.delete(id)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(new DeleteResponse(true, id));
    }

    @ExceptionHandler(InvalidDateException.class)
    ResponseEntity<ErrorResponse> handleInvalidDate(
            final InvalidDateException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("INVALID_DATE", e.getMessage()));
    }

    @ExceptionHandler(RecordValidationException.class)
    ResponseEntity<ErrorResponse> handleValidation(
            final RecordValidationException e) {
        LOG.warn("Rejected recipe: {}", e.getMessage());
        return ResponseEntity.unprocessableEntity()
                .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(DuplicateRecordException.class)
    ResponseEntity<ErrorResponse> handleDuplicate(
            final DuplicateRecordException e) {
        LOG.warn("Duplicate recipe: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    private static LocalDate parseDate(final String date) {
        try {
            return LocalDate.parse(date);
        } catch (final DateTimeParseException e) {
            throw new InvalidDateException(date, e);
        }
    }

    /** Raised for path dates that are not ISO dates. */
    static final class InvalidDateException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        InvalidDateException(final String date, final Throwable cause) {
            super("Invalid date '" + date + "', expected yyyy-MM-dd", cause);
        }
    }

    /**
     * Request to archive a recipe.
     *
     * @param name the recipe name, usually its file name
     * @param content the recipe text
     */
    public record CreateRecipeRequest(
            String name,
            String content
    ) {}

    /**
     * An archived recipe.
     *
     * @param id the record id
     * @param name the recipe name
     * @param content the recipe text
     * @param createdDate the ISO creation date
     * @param createdTime the ISO creation time
     * @param createdTimestamp the ISO-8601 creation timestamp with offset
     * @param timezone the zone the record was stamped in
     */
    public record RecipeResponse(
            long id,
            String name,
            String content,
            String createdDate,
            String createdTime,
            String createdTimestamp,
            String timezone
    ) {

        static RecipeResponse of(final RecipeRecord record) {
            return new RecipeResponse(
                    record.id(),
                    record.name(),
                    record.content(),
                    record.createdDate().toString(),
                    TIME_FORMAT.format(record.createdTime()),
                    record.createdTimestamp().toString(),
                    record.timezone());
        }
    }

    /**
     * A list of recipes.
     *
     * @param count the number of recipes
     * @param recipes the recipes
     */
    public record RecipeListResponse(
            int count,
            List<RecipeResponse> recipes
    ) {

        static RecipeListResponse of(final List<RecipeRecord> records) {
            final List<RecipeResponse> recipes = records.stream()
                    .map(RecipeResponse::of)
                    .toList();
            return new RecipeListResponse(recipes.size(), recipes);
        }
    }

    /** Dates that have recipes. */
    public record DatesResponse(
            int count,
            List<String> dates
    ) {}

    /** Recipe names of a date. */
    public record NamesResponse(
            String date,
            int count,
            List<String> names
    ) {}

    /** Result of a deletion. */
    public record DeleteResponse(
            boolean deleted,
            long id
    ) {}

    /**
     * Error body.
     *
     * @param error the error code
     * @param message the error description
     */
    public record ErrorResponse(
            String error,
            String message
    ) {}

}
