package com.starscape.photocatalog.features.resolution.app;

import com.starscape.photocatalog.common.exception.ResolutionParseException;
import com.starscape.photocatalog.features.resolution.domain.Resolution;
import com.starscape.photocatalog.features.resolution.domain.ResolutionPreset;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses target-size specifications: either a preset name or WIDTHxHEIGHT.
 */
@Component
public class ResolutionParser {
    
    private static final Pattern EXPLICIT = Pattern.compile("^\\s*(\\d+)\\s*[xX]\\s*(\\d+)\\s*$");
    
    /**
     * Parse a resolution specification.
     * Presets are checked first, case-insensitively.
     * @param spec e.g. "1920x1080", "4K", "instagram"
     * @return the resolution, or empty for anything malformed or non-positive
     */
    public Optional<Resolution> parse(String spec) {
        if (spec == null || spec.isBlank()) {
            return Optional.empty();
        }
        
        Optional<ResolutionPreset> preset = ResolutionPreset.fromKey(spec);
        if (preset.isPresent()) {
            return Optional.of(preset.get().resolution());
        }
        
        Matcher matcher = EXPLICIT.matcher(spec);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        
        try {
            int width = Integer.parseInt(matcher.group(1));
            int height = Integer.parseInt(matcher.group(2));
            if (width <= 0 || height <= 0) {
                return Optional.empty();
            }
            return Optional.of(new Resolution(width, height));
        } catch (NumberFormatException e) {
            // digits overflowing int
            return Optional.empty();
        }
    }
    
    /**
     * Strict variant of {@link #parse(String)} for callers that report the problem to the user.
     * @throws ResolutionParseException if the specification is not understood
     */
    public Resolution parseOrThrow(String spec) throws ResolutionParseException {
        return parse(spec).orElseThrow(() -> new ResolutionParseException(spec));
    }
    
    /**
     * Render as "WxH"; null renders as null.
     */
    public String format(Resolution resolution) {
        return resolution == null ? null : resolution.toString();
    }
    
    /**
     * All presets, smallest pixel area first. Ties keep declaration order.
     */
    public List<ResolutionPreset> presetsByArea() {
        return Arrays.stream(ResolutionPreset.values())
                .sorted(Comparator.comparingLong(preset -> preset.resolution().area()))
                .toList();
    }
}
