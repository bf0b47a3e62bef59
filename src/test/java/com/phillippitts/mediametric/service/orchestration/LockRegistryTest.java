package com.phillippitts.mediametric.service.orchestration;

import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.domain.StreamSpec;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LockRegistryTest {

    private static Asset asset(int id) {
        return Asset.builder("d", 0, id)
                .distorted(StreamSpec.raw(Path.of("/data/dis.yuv"), Geometry.of(4, 2), PixelFormat.YUV420P))
                .build();
    }

    @Test
    void equalAssetsShareOneLock() {
        LockRegistry registry = LockRegistry.of(List.of(asset(1), asset(1), asset(2)));

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.lockFor(asset(1))).isSameAs(registry.lockFor(asset(1)));
        assertThat(registry.lockFor(asset(1))).isNotSameAs(registry.lockFor(asset(2)));
    }

    @Test
    void unknownAssetIsRejected() {
        LockRegistry registry = LockRegistry.of(List.of(asset(1)));

        assertThatThrownBy(() -> registry.lockFor(asset(9)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not registered");
    }
}
