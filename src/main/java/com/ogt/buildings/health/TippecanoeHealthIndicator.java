package com.ogt.buildings.health;

import com.ogt.buildings.tiles.TippecanoeTileBuilder;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Optional;

/** Publica como {@code tippecanoe} la disponibilidad del generador de tiles. */
@Component("tippecanoe")
@RequiredArgsConstructor
public class TippecanoeHealthIndicator implements HealthIndicator {

    private final TippecanoeTileBuilder tileBuilder;

    @Override
    public Health health() {
        Optional<String> version = tileBuilder.probe();
        if (version.isPresent()) {
            return Health.up().withDetail("version", version.get()).build();
        }
        return Health.unknown()
                .withDetail("detail", "tippecanoe not available; tile generation is skipped")
                .build();
    }
}
