package com.continuum.relayer.pool;

import com.continuum.relayer.config.RelayerProperties;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Pools the relayer accepts orders for, loaded once from {@code relayer.pools}. */
@Component
public class PoolRegistry {

    private static final Logger log = LoggerFactory.getLogger(PoolRegistry.class);

    private final Map<String, RelayerProperties.Pool> pools;

    public PoolRegistry(RelayerProperties relayerProperties) {
        this.pools = relayerProperties.getPools().stream()
                .filter(pool -> pool.getPoolId() != null && !pool.getPoolId().isBlank())
                .collect(Collectors.toUnmodifiableMap(RelayerProperties.Pool::getPoolId, Function.identity()));
        log.info("Pool registry loaded: {} pools", pools.size());
    }

    public Optional<RelayerProperties.Pool> find(String poolId) {
        return Optional.ofNullable(pools.get(poolId));
    }

    /** True when the pool is configured and active. */
    public boolean isSupported(String poolId) {
        return find(poolId).map(RelayerProperties.Pool::isActive).orElse(false);
    }

    public List<RelayerProperties.Pool> findAll() {
        return pools.values().stream()
                .sorted((a, b) -> a.getPoolId().compareTo(b.getPoolId()))
                .toList();
    }
}
