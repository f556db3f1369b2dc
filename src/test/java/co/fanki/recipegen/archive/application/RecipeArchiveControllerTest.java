package co.fanki.recipegen.archive.application;

import co.fanki.recipegen.archive.domain.ArchiveStatistics;
import co.fanki.recipegen.archive.domain.DuplicateRecordException;
import co.fanki.recipegen.archive.domain.RecipeRecord;
import co.fanki.recipegen.archive.domain.RecordValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Tests for {@link RecipeArchiveController} over a mocked service.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class RecipeArchiveControllerTest {

    private static final LocalDate MARCH_1 = LocalDate.of(2024, 3, 1);

    private static final RecipeRecord RECORD = RecipeRecord.create(
            "Dockerfile", "FROM python:3.8-slim\n",
            ZonedDateTime.of(2024, 3, 1, 10, 15, 30, 500_000_000,
                    ZoneId.of("UTC"))).withId(1);

    private RecipeArchiveService archiveService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        archiveService = mock(RecipeArchiveService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new RecipeArchiveController(archiveService)).build();
    }

    @Test
    void whenPosting_givenValidRecipe_shouldReturnCreated() throws Exception {
        when(archiveService.create("Dockerfile", "FROM python:3.8-slim\n"))
                .thenReturn(RECORD);

        mockMvc.perform(post("/api/recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Dockerfile\","
                                + "\"content\":\"FROM python:3.8-slim\\n\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(1))
                .andExpect(jsonPath("$.name").value("Dockerfile"))
                .andExpect(jsonPath("$.createdDate").value("2024-03-01"))
                .andExpect(jsonPath("$.createdTime").value("10:15:30.500000"))
                .andExpect(jsonPath("$.timezone").value("UTC"));
    }

    @Test
    void whenPosting_givenEmptyName_shouldReturnUnprocessable()
            throws Exception {
        when(archiveService.create(eq(""), anyString())).thenThrow(
                new RecordValidationException("Recipe name cannot be empty"));

        mockMvc.perform(post("/api/recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"\",\"content\":\"FROM x\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message")
                        .value("Recipe name cannot be empty"));
    }

    @Test
    void whenPosting_givenDuplicate_shouldReturnConflict() throws Exception {
        when(archiveService.create(anyString(), anyString())).thenThrow(
                new DuplicateRecordException("Dockerfile", MARCH_1,
                        LocalTime.NOON, new IllegalStateException("unique")));

        mockMvc.perform(post("/api/recipes")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Dockerfile\",\"content\":\"x\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE_ENTRY"));
    }

    @Test
    void whenGettingById_givenUnknownId_shouldReturnNotFound()
            throws Exception {
        when(archiveService.findById(9)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/recipes/9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void whenGettingById_givenKnownId_shouldReturnRecipe() throws Exception {
        when(archiveService.findById(1)).thenReturn(Optional.of(RECORD));

        mockMvc.perform(get("/api/recipes/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content")
                        .value("FROM python:3.8-slim\n"));
    }

    @Test
    void whenListingByDate_givenInvalidDate_shouldReturnBadRequest()
            throws Exception {
        mockMvc.perform(get("/api/recipes/by-date/2024-13-45"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_DATE"));

        verifyNoInteractions(archiveService);
    }

    @Test
    void whenListingByDate_givenRecipes_shouldReturnThem() throws Exception {
        when(archiveService.findByDate(MARCH_1)).thenReturn(List.of(RECORD));

        mockMvc.perform(get("/api/recipes/by-date/2024-03-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.recipes[0].name").value("Dockerfile"));
    }

    @Test
    void whenListingNames_shouldReturnNamesOfTheDate() throws Exception {
        when(archiveService.findNames(MARCH_1))
                .thenReturn(List.of("Dockerfile", "web.Dockerfile"));

        mockMvc.perform(get("/api/recipes/by-date/2024-03-01/names"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.date").value("2024-03-01"))
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.names[1]").value("web.Dockerfile"));
    }

    @Test
    void whenGettingLatestContent_shouldReturnPlainText() throws Exception {
        when(archiveService.findLatest(MARCH_1, "Dockerfile"))
                .thenReturn(Optional.of(RECORD));

        mockMvc.perform(get("/api/recipes/by-date/2024-03-01/Dockerfile/content"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(
                        MediaType.TEXT_PLAIN))
                .andExpect(content().string("FROM python:3.8-slim\n"));
    }

    @Test
    void whenGettingLatest_givenUnknownName_shouldReturnNotFound()
            throws Exception {
        when(archiveService.findLatest(any(), anyString()))
                .thenReturn(Optional.empty());

        mockMvc.perform(get("/api/recipes/by-date/2024-03-01/other"))
                .andExpect(status().isNotFound());
    }

    @Test
    void whenListingDates_shouldReturnIsoDates() throws Exception {
        when(archiveService.findDates()).thenReturn(
                List.of(LocalDate.of(2024, 3, 2), MARCH_1));

        mockMvc.perform(get("/api/recipes/dates"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.count").value(2))
                .andExpect(jsonPath("$.dates[0]").value("2024-03-02"));
    }

    @Test
    void whenGettingStatistics_shouldReturnCounts() throws Exception {
        when(archiveService.statistics())
                .thenReturn(new ArchiveStatistics(3, 2, 1));

        mockMvc.perform(get("/api/recipes/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRecipes").value(3))
                .andExpect(jsonPath("$.uniqueDates").value(2))
                .andExpect(jsonPath("$.uniqueNames").value(1));
    }

    @Test
    void whenDeleting_shouldReturnOkOrNotFound() throws Exception {
        when(archiveService.delete(1)).thenReturn(true);
        when(archiveService.delete(2)).thenReturn(false);

        mockMvc.perform(delete("/api/recipes/1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deleted").value(true));
        mockMvc.perform(delete("/api/recipes/2"))
                .andExpect(status().isNotFound());

        verify(archiveService).delete(2);
    }

}
