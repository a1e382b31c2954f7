package com.wangbin.liveprobe.core.registry;

import com.wangbin.liveprobe.common.domain.entity.DeviceInfo;
import com.wangbin.liveprobe.common.exception.BusinessException;
import com.wangbin.liveprobe.common.web.result.ResultCode;
import com.wangbin.liveprobe.core.config.ProbeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryDeviceRegistryTest {

    private InMemoryDeviceRegistry registry;
    private final List<DeviceChangeEvent> events = new ArrayList<>();

    @BeforeEach
    void setUp() {
        ProbeProperties properties = new ProbeProperties();
        properties.getDevices().add(device("b-unit", "10.0.0.2"));
        properties.getDevices().add(device("a-unit", "10.0.0.1"));
        properties.getDevices().add(device("broken", null));
        registry = new InMemoryDeviceRegistry(properties);
        registry.registerListener(events::add);
    }

    @Test
    void seedsValidDevicesSortedById() {
        assertEquals(List.of("a-unit", "b-unit"),
                registry.getAllDevices().stream().map(DeviceInfo::getDeviceId).toList());
        assertNull(registry.getDevice("broken"));
    }

    @Test
    void returnsIndependentCopies() {
        registry.getDevice("a-unit").setHost("changed");
        assertEquals("10.0.0.1", registry.getDevice("a-unit").getHost());
    }

    @Test
    void registerRejectsDuplicatesAndInvalid() {
        registry.register(device("c-unit", "10.0.0.3"));
        assertEquals(DeviceChangeEvent.Type.ADDED, events.get(0).getType());

        BusinessException duplicate = assertThrows(BusinessException.class,
                () -> registry.register(device("c-unit", "10.0.0.9")));
        assertEquals(ResultCode.DEVICE_INVALID, duplicate.getResultCode());
        assertThrows(BusinessException.class, () -> registry.register(device(" ", "10.0.0.9")));
        assertEquals(1, events.size());
    }

    @Test
    void updateFlagsPollingConfigChanges() {
        DeviceInfo renamed = registry.getDevice("a-unit");
        renamed.setDeviceName("Camera A");
        registry.update(renamed);
        assertFalse(events.get(0).isConfigChanged());

        DeviceInfo moved = registry.getDevice("a-unit");
        moved.setHost("10.0.0.100");
        registry.update(moved);
        assertTrue(events.get(1).isConfigChanged());

        BusinessException missing = assertThrows(BusinessException.class,
                () -> registry.update(device("zzz", "10.0.0.5")));
        assertEquals(ResultCode.DEVICE_NOT_FOUND, missing.getResultCode());
    }

    @Test
    void disableAndRemove() {
        registry.setEnabled("b-unit", false);
        assertEquals(List.of("a-unit"),
                registry.getEnabledDevices().stream().map(DeviceInfo::getDeviceId).toList());

        assertTrue(registry.remove("b-unit"));
        assertFalse(registry.remove("b-unit"));
        assertEquals(DeviceChangeEvent.Type.REMOVED, events.get(events.size() - 1).getType());
    }

    @Test
    void failingListenerDoesNotBreakOthers() {
        List<String> seen = new ArrayList<>();
        registry.registerListener(event -> {
            throw new IllegalStateException("listener failure");
        });
        registry.registerListener(event -> seen.add(event.getDeviceId()));

        registry.register(device("d-unit", "10.0.0.4"));

        assertEquals(List.of("d-unit"), seen);
    }

    private static DeviceInfo device(String id, String host) {
        DeviceInfo device = new DeviceInfo();
        device.setDeviceId(id);
        device.setHost(host);
        device.setToken("t");
        return device;
    }
}
