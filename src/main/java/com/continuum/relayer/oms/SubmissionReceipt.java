package com.continuum.relayer.oms;

import com.continuum.relayer.domain.model.Order;
import java.math.BigInteger;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** What intake hands back for an accepted submission. */
@Value
@Builder
public class SubmissionReceipt {

    Order order;
    Duration estimatedExecutionTime;
    BigInteger fee;
}
