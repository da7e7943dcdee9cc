package decentralabs.attendance.service.time;

import java.time.Clock;
import java.time.Instant;
import org.springframework.stereotype.Component;

@Component
public class SystemClockSource implements ClockSource {

    private final Clock clock;

    public SystemClockSource() {
        this(Clock.systemUTC());
    }

    SystemClockSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Instant now() {
        return clock.instant();
    }
}
