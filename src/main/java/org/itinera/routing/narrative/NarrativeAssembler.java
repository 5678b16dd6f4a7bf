package org.itinera.routing.narrative;

import lombok.extern.slf4j.Slf4j;
import org.itinera.routing.collaborator.CollaboratorResult;
import org.itinera.routing.collaborator.Translator;
import org.itinera.routing.core.PathMetrics;
import org.itinera.routing.core.RouteResult;
import org.itinera.routing.core.RoutingRuntimeConfig;
import org.itinera.routing.segmentation.Leg;
import org.itinera.routing.segmentation.Segmentation;

import java.util.Locale;
import java.util.Objects;

/**
 * Turns metrics and segmentation into a displayable {@link RouteResult}.
 *
 * <p>The summary line reads {@code "Total: <km>km, ~<h>h<mm>"} followed by optional weather,
 * fare and split-trip notes. Translation failures fall back to source text.</p>
 */
@Slf4j
public final class NarrativeAssembler {
    static final String WEATHER_NOTE = " | [Météo] Route dégradée (+%dmin)";
    static final String FARE_NOTE = " | Bus: ~%dF / Taxi: ~%dF";
    static final String SPLIT_NOTE = " | Suggestion: découper en 2 jours";

    private final RoutingRuntimeConfig config;
    private final Translator translator;
    private final PlaceNameLocalizer localizer;

    public NarrativeAssembler(RoutingRuntimeConfig config, Translator translator, PlaceNameLocalizer localizer) {
        this.config = Objects.requireNonNull(config, "config");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.localizer = Objects.requireNonNull(localizer, "localizer");
    }

    public RouteResult assemble(NarrativeInput input) {
        Objects.requireNonNull(input, "input");
        Segmentation segmentation = input.getSegmentation();
        PathMetrics metrics = input.getMetrics();

        RouteResult.RouteResultBuilder builder = RouteResult.builder()
                .departure(localizer.localize(titleCase(input.getStartLabel())))
                .destination(new Leg(localizer.localize(titleCase(input.getEndLabel())), segmentation.trailingKm()))
                .metrics(metrics)
                .pathExternalIds(input.getPathExternalIds())
                .searchCost(input.getSearchCost());
        for (Leg leg : segmentation.legs()) {
            builder.leg(leg.withPlaceName(localizer.localize(leg.placeName())));
        }
        if (input.getAvoidLabel() != null && !input.getAvoidLabel().isBlank()) {
            builder.avoidedPlace(localizer.localize(titleCase(input.getAvoidLabel())));
        }

        String seasonLabel = input.getSeason().label();
        double adjustedSeconds = adjustedDuration(metrics, input.getSeason());
        String summary = summary(metrics, input.getSeason(), adjustedSeconds);

        return builder
                .seasonLabel(seasonLabel)
                .translatedSeasonLabel(translate(seasonLabel))
                .summary(summary)
                .translatedSummary(translate(summary))
                .adjustedDurationSeconds(adjustedSeconds)
                .build();
    }

    /**
     * Builds the source-language summary line.
     */
    String summary(PathMetrics metrics, Season season, double adjustedSeconds) {
        double km = metrics.distanceKm();
        long totalSeconds = (long) adjustedSeconds;
        long hours = totalSeconds / 3600L;
        long minutes = (totalSeconds % 3600L) / 60L;

        StringBuilder text = new StringBuilder()
                .append(String.format(Locale.ROOT, "Total: %.0fkm, ~%dh%02d", km, hours, minutes));
        if (isWeatherDegraded(metrics, season)) {
            text.append(String.format(Locale.ROOT, WEATHER_NOTE, config.getRainyDelaySeconds() / 60L));
        }
        text.append(String.format(Locale.ROOT, FARE_NOTE,
                (long) (km * config.getBusFarePerKm()),
                (long) (km * config.getTaxiFarePerKm())));
        if (hours >= config.getLongTripHours()) {
            text.append(SPLIT_NOTE);
        }
        return text.toString();
    }

    double adjustedDuration(PathMetrics metrics, Season season) {
        double seconds = metrics.getDurationSeconds();
        if (isWeatherDegraded(metrics, season)) {
            seconds += config.getRainyDelaySeconds();
        }
        return seconds;
    }

    private boolean isWeatherDegraded(PathMetrics metrics, Season season) {
        return season == Season.RAINY && metrics.getNorthernmostLatitude() > config.getRainyLatitudeThreshold();
    }

    private String translate(String text) {
        CollaboratorResult<String> translated;
        try {
            translated = translator.translate(text);
        } catch (RuntimeException ex) {
            translated = CollaboratorResult.failure("translator threw " + ex.getClass().getSimpleName(), ex);
        }
        if (translated == null || !translated.isSuccess()) {
            log.warn("Translation unavailable ({}), keeping source text",
                    translated == null ? "no result" : translated.failureReason());
            return text;
        }
        return translated.value();
    }

    /**
     * Upper-cases the first letter of every word and lower-cases the rest. A word starts
     * after any non-letter, so {@code "porto-novo"} becomes {@code "Porto-Novo"}.
     */
    static String titleCase(String text) {
        StringBuilder out = new StringBuilder(text.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < text.length(); ) {
            int codePoint = text.codePointAt(i);
            boolean letter = Character.isLetter(codePoint);
            if (letter) {
                out.appendCodePoint(previousIsLetter
                        ? Character.toLowerCase(codePoint)
                        : Character.toTitleCase(codePoint));
            } else {
                out.appendCodePoint(codePoint);
            }
            previousIsLetter = letter;
            i += Character.charCount(codePoint);
        }
        return out.toString();
    }
}
