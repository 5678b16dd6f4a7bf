package org.itinera.routing.narrative;

import org.itinera.routing.collaborator.CollaboratorResult;
import org.itinera.routing.collaborator.Translator;
import org.itinera.routing.core.PathMetrics;
import org.itinera.routing.core.RouteResult;
import org.itinera.routing.core.RoutingRuntimeConfig;
import org.itinera.routing.segmentation.Leg;
import org.itinera.routing.segmentation.Segmentation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Narrative Assembler Tests")
class NarrativeAssemblerTest {
    private static final double HOUR = 3_600.0d;

    private static PathMetrics metrics(double meters, double seconds, double northernmost) {
        return PathMetrics.builder()
                .distanceMeters(meters)
                .durationSeconds(seconds)
                .northernmostLatitude(northernmost)
                .linkCount(3)
                .build();
    }

    private static NarrativeAssembler assembler(Translator translator) {
        return new NarrativeAssembler(RoutingRuntimeConfig.defaults(), translator, PlaceNameLocalizer.fon());
    }

    private static NarrativeInput.NarrativeInputBuilder southernRoute() {
        return NarrativeInput.builder()
                .startLabel("cotonou")
                .endLabel("bohicon")
                .metrics(metrics(108_000, 125 * 60, 7.1782))
                .segmentation(new Segmentation(
                        List.of(new Leg("Abomey-Calavi", 18.0), new Leg("Allada", 30.0)), 60_000, "Bohicon"))
                .pathExternalIds(List.of("cotonou", "calavi", "allada", "bohicon"))
                .searchCost(7_500);
    }

    @Nested
    @DisplayName("Summary line")
    class SummaryLine {
        private final NarrativeAssembler assembler = assembler(Translator.identity());

        @Test
        @DisplayName("Dry-season summary has distance, duration and fares")
        void testDrySummary() {
            PathMetrics metrics = metrics(108_000, 125 * 60, 7.1782);
            double seconds = assembler.adjustedDuration(metrics, Season.DRY);

            assertEquals("Total: 108km, ~2h05 | Bus: ~1944F / Taxi: ~3240F",
                    assembler.summary(metrics, Season.DRY, seconds));
        }

        @Test
        @DisplayName("Rainy season north of the threshold adds delay, weather note and split suggestion")
        void testRainyNorthernSummary() {
            PathMetrics metrics = metrics(553_000, 585 * 60, 10.3042);
            double seconds = assembler.adjustedDuration(metrics, Season.RAINY);

            assertEquals(585 * 60 + 1_800, seconds);
            assertEquals("Total: 553km, ~10h15 | [Météo] Route dégradée (+30min)"
                            + " | Bus: ~9954F / Taxi: ~16590F | Suggestion: découper en 2 jours",
                    assembler.summary(metrics, Season.RAINY, seconds));
        }

        @Test
        @DisplayName("Weather delay requires a latitude strictly above the threshold")
        void testThresholdLatitudeIsNotDegraded() {
            PathMetrics metrics = metrics(100_000, HOUR, 9.8);
            assertEquals(HOUR, assembler.adjustedDuration(metrics, Season.RAINY));
            assertFalse(assembler.summary(metrics, Season.RAINY, HOUR).contains("Météo"));
        }

        @Test
        @DisplayName("Dry season never adds weather delay")
        void testDrySeasonNorthernRoute() {
            PathMetrics metrics = metrics(100_000, HOUR, 11.0);
            assertEquals(HOUR, assembler.adjustedDuration(metrics, Season.DRY));
        }

        @ParameterizedTest(name = "{0}s -> {1}")
        @CsvSource({
                "35999, false",
                "36000, true",
                "50000, true"
        })
        @DisplayName("Split suggestion starts at ten full hours")
        void testSplitSuggestionBoundary(double seconds, boolean suggested) {
            PathMetrics metrics = metrics(100_000, seconds, 6.5);
            String summary = assembler.summary(metrics, Season.DRY, seconds);
            assertEquals(suggested, summary.endsWith(NarrativeAssembler.SPLIT_NOTE));
        }

        @Test
        @DisplayName("Fares and kilometers are truncated and rounded like display figures")
        void testFareTruncation() {
            PathMetrics metrics = metrics(12_345, 59 * 60 + 59, 6.5);
            String summary = assembler.summary(metrics, Season.DRY, metrics.getDurationSeconds());

            assertEquals("Total: 12km, ~0h59 | Bus: ~222F / Taxi: ~370F", summary);
        }

        @Test
        @DisplayName("Configured rates and delay flow into the text")
        void testConfiguredRates() {
            RoutingRuntimeConfig config = RoutingRuntimeConfig.builder()
                    .busFarePerKm(10)
                    .taxiFarePerKm(25)
                    .rainyDelaySeconds(2_700)
                    .rainyLatitudeThreshold(7.0)
                    .build();
            NarrativeAssembler custom = new NarrativeAssembler(config, Translator.identity(), PlaceNameLocalizer.none());
            PathMetrics metrics = metrics(100_000, HOUR, 7.5);

            double seconds = custom.adjustedDuration(metrics, Season.RAINY);
            assertEquals("Total: 100km, ~1h45 | [Météo] Route dégradée (+45min) | Bus: ~1000F / Taxi: ~2500F",
                    custom.summary(metrics, Season.RAINY, seconds));
        }
    }

    @Nested
    @DisplayName("Assembled result")
    class AssembledResult {

        @Test
        @DisplayName("Labels are title-cased and localized, legs keep their distances")
        void testLabelsAndLegs() {
            RouteResult result = assembler(Translator.identity()).assemble(southernRoute().avoidLabel("ouidah").build());

            assertEquals("Kutɔnu (Cotonou)", result.getDeparture());
            assertEquals(List.of(new Leg("Abomey-Calavi", 18.0), new Leg("Alada (Allada)", 30.0)), result.getLegs());
            assertEquals(new Leg("Bɔxikɔn (Bohicon)", 60.0), result.getDestination());
            assertEquals("Glexwé (Ouidah)", result.getAvoidedPlace());
            assertEquals("Saison Sèche", result.getSeasonLabel());
            assertEquals(List.of("cotonou", "calavi", "allada", "bohicon"), result.getPathExternalIds());
            assertEquals(7_500.0d, result.getSearchCost());
        }

        @Test
        @DisplayName("Ordered display fields")
        void testAsFields() {
            RouteResult result = assembler(Translator.identity()).assemble(southernRoute().avoidLabel("ouidah").build());
            Map<String, String> fields = result.asFields();

            assertEquals(List.of("departure", "step_1", "step_2", "destination", "avoid_city", "season", "info_sup"),
                    List.copyOf(fields.keySet()));
            assertEquals("Abomey-Calavi - 18.0km", fields.get("step_1"));
            assertEquals("Alada (Allada) - 30.0km", fields.get("step_2"));
            assertEquals("Bɔxikɔn (Bohicon) - 60.0km", fields.get("destination"));
            assertEquals("Total: 108km, ~2h05 | Bus: ~1944F / Taxi: ~3240F", fields.get("info_sup"));
        }

        @Test
        @DisplayName("Avoid city is absent when nothing was avoided")
        void testNoAvoidCity() {
            RouteResult result = assembler(Translator.identity()).assemble(southernRoute().build());
            assertNull(result.getAvoidedPlace());
            assertFalse(result.asFields().containsKey(RouteResult.FIELD_AVOID_CITY));
        }

        @Test
        @DisplayName("Season label and summary are translated, source text is kept")
        void testTranslation() {
            Translator shouting = text -> CollaboratorResult.success(text.toUpperCase(Locale.ROOT));
            RouteResult result = assembler(shouting).assemble(southernRoute().season(Season.RAINY).build());

            assertEquals("Saison des Pluies", result.getSeasonLabel());
            assertEquals("SAISON DES PLUIES", result.getTranslatedSeasonLabel());
            assertEquals(result.getSummary().toUpperCase(Locale.ROOT), result.getTranslatedSummary());
            assertEquals("SAISON DES PLUIES", result.asFields().get("season"));
        }

        @Test
        @DisplayName("Failed or throwing translation falls back to source text")
        void testTranslationFallback() {
            Translator failing = text -> CollaboratorResult.failure("quota exhausted");
            Translator throwing = text -> {
                throw new IllegalStateException("network down");
            };

            for (Translator translator : List.of(failing, throwing)) {
                RouteResult result = assembler(translator).assemble(southernRoute().build());
                assertEquals(result.getSummary(), result.getTranslatedSummary());
                assertEquals("Saison Sèche", result.getTranslatedSeasonLabel());
            }
        }
    }

    @Nested
    @DisplayName("Place names")
    class PlaceNames {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "cotonou, Cotonou",
                "PORTO-NOVO, Porto-Novo",
                "abomey-calavi, Abomey-Calavi",
                "grand popo, Grand Popo",
                "l'ouidah, L'Ouidah"
        })
        @DisplayName("Title case capitalizes after every non-letter")
        void testTitleCase(String input, String expected) {
            assertEquals(expected, NarrativeAssembler.titleCase(input));
        }

        @Test
        @DisplayName("Localizer matches case-insensitively on the text before the first comma")
        void testLocalizer() {
            PlaceNameLocalizer fon = PlaceNameLocalizer.fon();

            assertEquals("Xɔgbonu (Porto-Novo)", fon.localize("porto-novo"));
            assertEquals("Agbomɛ (Abomey)", fon.localize("Abomey, Benin"));
            assertEquals("Parakou", fon.localize("Parakou"));
            assertEquals("Abomey-Calavi", fon.localize("Abomey-Calavi"));
            assertTrue(fon.isKnown("ALLADA"));
            assertNull(fon.localize(null));
        }

        @Test
        @DisplayName("Season labels")
        void testSeasonLabels() {
            assertEquals("Saison Sèche", Season.DRY.label());
            assertEquals("Saison des Pluies", Season.of(true).label());
            assertEquals(Season.DRY, Season.of(false));
        }
    }
}
