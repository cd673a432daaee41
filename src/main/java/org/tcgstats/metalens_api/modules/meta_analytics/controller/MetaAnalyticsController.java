package org.tcgstats.metalens_api.modules.meta_analytics.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.tcgstats.metalens_api.modules.meta_analytics.engine.GroupBy;
import org.tcgstats.metalens_api.modules.meta_analytics.engine.RankingsQuery;
import org.tcgstats.metalens_api.modules.meta_analytics.model.FormatArchetypesResult;
import org.tcgstats.metalens_api.modules.meta_analytics.model.MatchupMatrixResult;
import org.tcgstats.metalens_api.modules.meta_analytics.model.RankingsResult;
import org.tcgstats.metalens_api.modules.meta_analytics.service.MetaAnalyticsService;

import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

/**
 * REST controller for format-wide meta analytics.
 */
@Tag(name = "Meta Analytics", description = "Archetype rankings and matchup matrices per format.")
@Validated
@RestController
@RequestMapping("/api/v1/meta")
public class MetaAnalyticsController {

    private final MetaAnalyticsService metaService;

    public MetaAnalyticsController(MetaAnalyticsService metaService) {
        this.metaService = metaService;
    }

    /**
     * Example:
     * GET /api/v1/meta/archetypes?format=Standard&current_days=14&previous_days=14&group_by=strategy
     */
    @Operation(
            summary = "Rank archetypes by meta share",
            description = "Compares meta share and win rate of each archetype in the current period with the previous period.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = RankingsResult.class))),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "404", description = "No decklists in the current period",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "503", description = "Tournament data unavailable",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/archetypes")
    public RankingsResult archetypes(
            @RequestParam("format") @NotBlank String format,
            @RequestParam(name = "current_days", defaultValue = "14") @Positive int currentDays,
            @RequestParam(name = "previous_days", defaultValue = "14") @Positive int previousDays,
            @Parameter(description = "Start of the previous period in days before now")
            @RequestParam(name = "previous_start_days", required = false) @Positive Integer previousStartDays,
            @Parameter(description = "End of the previous period in days before now")
            @RequestParam(name = "previous_end_days", required = false) @PositiveOrZero Integer previousEndDays,
            @RequestParam(name = "color_identity", required = false) String colorIdentity,
            @Parameter(description = "aggro, midrange, control, ramp or combo")
            @RequestParam(name = "strategy", required = false) String strategy,
            @Parameter(description = "color_identity or strategy")
            @RequestParam(name = "group_by", required = false) String groupBy) {

        var query = RankingsQuery.of(format, currentDays, previousDays)
                .withPreviousOffsets(previousStartDays, previousEndDays)
                .withFilters(colorIdentity, strategy)
                .withGroupBy(GroupBy.fromParameter(groupBy));

        return metaService.rankings(query)
                .orElseThrow(() -> new ResponseStatusException(NOT_FOUND,
                        "No archetype data found for format '%s' in the specified time window".formatted(format)));
    }

    /**
     * Example:
     * GET /api/v1/meta/matchups?format=Modern&days=30
     */
    @Operation(
            summary = "Matchup matrix",
            description = "Head-to-head win rates between every pair of archetypes that met in the period.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "OK",
                            content = @Content(mediaType = "application/json",
                                    schema = @Schema(implementation = MatchupMatrixResult.class))),
                    @ApiResponse(responseCode = "400", description = "Bad Request",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "404", description = "No matches in the period",
                            content = @Content(mediaType = "application/problem+json")),
                    @ApiResponse(responseCode = "503", description = "Tournament data unavailable",
                            content = @Content(mediaType = "application/problem+json"))
            }
    )
    @GetMapping("/matchups")
    public MatchupMatrixResult matchups(
            @RequestParam("format") @NotBlank String format,
            @RequestParam(name = "days", defaultValue = "14") @Positive int days) {

        return metaService.matchupMatrix(format, days)
                .orElseThrow(() -> new ResponseStatusException(NOT_FOUND,
                        "No matchup data found for format '%s' in the last %d days".formatted(format, days)));
    }

    @Operation(
            summary = "Archetypes of a format",
            description = "Every archetype registered in the period with its deck count and meta share. Empty when nothing was played."
    )
    @GetMapping("/format-archetypes")
    public FormatArchetypesResult formatArchetypes(
            @RequestParam("format") @NotBlank String format,
            @RequestParam(name = "days", defaultValue = "30") @Positive int days) {
        return metaService.formatArchetypes(format, days);
    }

    @Operation(summary = "Health check for the meta analytics API")
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "UP",
                "service", "meta-analytics"
        ));
    }
}
