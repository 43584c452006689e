package com.starscape.photocatalog.common.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for decoding and re-encoding images.
 * Binds to app.imaging.* properties from application.yml
 */
@Validated
@ConfigurationProperties(prefix = "app.imaging")
public class ImagingProperties {
    
    @DecimalMin("0.1")
    @DecimalMax("1.0")
    private double jpegQuality = 0.95;
    
    /**
     * dcraw-compatible executable used when a RAW file has no usable embedded preview.
     */
    @NotBlank
    private String rawDecoderCommand = "dcraw";
    
    public double getJpegQuality() {
        return jpegQuality;
    }
    
    public void setJpegQuality(double jpegQuality) {
        this.jpegQuality = jpegQuality;
    }
    
    public String getRawDecoderCommand() {
        return rawDecoderCommand;
    }
    
    public void setRawDecoderCommand(String rawDecoderCommand) {
        this.rawDecoderCommand = rawDecoderCommand;
    }
}
