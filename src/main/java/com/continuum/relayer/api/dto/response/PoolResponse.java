package com.continuum.relayer.api.dto.response;

import com.continuum.relayer.config.RelayerProperties;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PoolResponse {

    private final String poolId;
    private final String tokenAMint;
    private final String tokenBMint;
    private final String tokenASymbol;
    private final String tokenBSymbol;
    private final int tokenADecimals;
    private final int tokenBDecimals;
    private final boolean active;

    public static PoolResponse from(RelayerProperties.Pool pool) {
        return PoolResponse.builder()
                .poolId(pool.getPoolId())
                .tokenAMint(pool.getTokenAMint())
                .tokenBMint(pool.getTokenBMint())
                .tokenASymbol(pool.getTokenASymbol())
                .tokenBSymbol(pool.getTokenBSymbol())
                .tokenADecimals(pool.getTokenADecimals())
                .tokenBDecimals(pool.getTokenBDecimals())
                .active(pool.isActive())
                .build();
    }
}
