package com.starscape.photocatalog.features.device.infra;

import com.starscape.photocatalog.common.config.DeviceProperties;
import com.starscape.photocatalog.features.device.domain.HostIdentity;
import com.starscape.photocatalog.features.device.domain.MountTable;
import com.starscape.photocatalog.features.device.domain.VolumeDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Wires the platform lookups used by the device resolver.
 */
@Configuration
public class DeviceConfig {
    
    @Bean
    public MountTable mountTable(DeviceProperties deviceProperties) {
        return new ProcMountTable(Path.of(deviceProperties.getMountTable()));
    }
    
    @Bean
    public VolumeDirectory volumeDirectory(DeviceProperties deviceProperties) {
        return new DiskByIdVolumeDirectory(
            Path.of(deviceProperties.getByLabelDir()),
            Path.of(deviceProperties.getByUuidDir())
        );
    }
    
    @Bean
    public HostIdentity hostIdentity() {
        return new LocalHostIdentity();
    }
}
