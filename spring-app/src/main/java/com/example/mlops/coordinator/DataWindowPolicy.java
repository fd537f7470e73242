package com.example.mlops.coordinator;

import com.example.mlops.dto.DataWindow;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;

/**
 * Picks the data window a retrain job trains on: the previous calendar month,
 * since the current one is still incomplete upstream.
 */
@Component
public class DataWindowPolicy {

    private final Clock clock;

    public DataWindowPolicy(Clock clock) {
        this.clock = clock;
    }

    public DataWindow nextWindow() {
        return DataWindow.ofMonth(YearMonth.now(clock).minusMonths(1));
    }
}
