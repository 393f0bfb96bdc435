package org.tickbridge.world;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.tickbridge.runtime.api.DuplicateBridgeException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class WorldTest {

    private record Ping(int sequence) {}

    private final World world = new World();

    @Test
    void resourcesAreKeyedByType() {
        assertThat(world.insertResource(String.class, "first")).isEmpty();
        assertThat(world.insertResource(String.class, "second")).contains("first");

        assertThat(world.resource(String.class)).isEqualTo("second");
        assertThat(world.getResource(Integer.class)).isEmpty();
        assertThat(world.removeResource(String.class)).contains("second");
        assertThatThrownBy(() -> world.resource(String.class))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(String.class.getName());
    }

    @Test
    void eventsMustBeRegisteredBeforeUse() {
        assertThat(world.hasEvents(Ping.class)).isFalse();
        assertThatThrownBy(() -> world.sendEvent(new Ping(1))).isInstanceOf(IllegalStateException.class);

        Events<Ping> storage = world.addEvent(Ping.class);

        assertThat(world.addEvent(Ping.class)).isSameAs(storage);
        assertThat(world.events(Ping.class)).isSameAs(storage);
    }

    @Test
    void updateEventsRotatesEveryStorage() {
        world.addEvent(Ping.class);
        world.sendEvent(new Ping(1));

        world.updateEvents();
        assertThat(world.events(Ping.class).len()).isEqualTo(1);

        world.updateEvents();
        assertThat(world.events(Ping.class).isEmpty()).isTrue();
    }

    @Test
    void bridgeClaimIsExclusivePerType() {
        world.claimBridge(Ping.class);

        assertThat(world.isBridged(Ping.class)).isTrue();
        assertThatThrownBy(() -> world.claimBridge(Ping.class))
                .isInstanceOf(DuplicateBridgeException.class)
                .hasMessageContaining(Ping.class.getName());

        world.releaseBridge(Ping.class);
        world.claimBridge(Ping.class);
        assertThat(world.isBridged(Ping.class)).isTrue();
    }
}
