package com.continuum.relayer.api.dto.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.math.BigInteger;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of {@code POST /api/v1/orders}. Amounts are raw token units.
 *
 * <p>{@code transaction} is the user's signed submit-order transaction (base64). When present
 * the relayer broadcasts it before accepting the order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubmitOrderRequest {

    private static final String BASE58_ADDRESS = "^[1-9A-HJ-NP-Za-km-z]{32,44}$";

    @NotBlank
    @Pattern(regexp = BASE58_ADDRESS, message = "must be a base58 address")
    @JsonAlias("userPublicKey")
    private String userAddress;

    @NotBlank
    @Pattern(regexp = BASE58_ADDRESS, message = "must be a base58 address")
    private String poolId;

    @NotNull
    @Positive
    private BigInteger amountIn;

    @NotNull
    @PositiveOrZero
    private BigInteger minAmountOut;

    @JsonAlias("isBaseInput")
    private boolean baseInput;

    @NotBlank
    @Size(max = 64)
    private String nonce;

    private String transaction;
}
