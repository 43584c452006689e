package com.starscape.photocatalog.common.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for device and mount identification.
 * Binds to app.device.* properties from application.yml
 */
@Validated
@ConfigurationProperties(prefix = "app.device")
public class DeviceProperties {
    
    @NotBlank
    private String mountTable = "/proc/mounts";
    
    @NotBlank
    private String byLabelDir = "/dev/disk/by-label";
    
    @NotBlank
    private String byUuidDir = "/dev/disk/by-uuid";
    
    public String getMountTable() {
        return mountTable;
    }
    
    public void setMountTable(String mountTable) {
        this.mountTable = mountTable;
    }
    
    public String getByLabelDir() {
        return byLabelDir;
    }
    
    public void setByLabelDir(String byLabelDir) {
        this.byLabelDir = byLabelDir;
    }
    
    public String getByUuidDir() {
        return byUuidDir;
    }
    
    public void setByUuidDir(String byUuidDir) {
        this.byUuidDir = byUuidDir;
    }
}
