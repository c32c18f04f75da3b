package com.libragraph.vpk.core.archive;

import com.libragraph.vpk.core.crypto.KeyDerivation;
import com.libragraph.vpk.util.KeyMaterial;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

@ApplicationScoped
public class PackagePipelineProducer {

    private static final Logger log = Logger.getLogger(PackagePipelineProducer.class);

    @ConfigProperty(name = "vpk.key.secret")
    String secret;

    @ConfigProperty(name = "vpk.key.salt")
    String salt;

    @Inject
    Config config;

    @Produces
    @Singleton
    public PackagePipeline packagePipeline() {
        PackageSettings settings = PackageSettings.from(config);
        KeyMaterial key = KeyDerivation.derive(secret, salt, settings.kdf());
        log.infof("Package pipeline ready: %s/%s, format version %d",
                settings.encryption().label(), settings.compression().label(), settings.formatVersion());
        return new PackagePipeline(key, settings);
    }
}
