package com.sandy.aiot.automation.engine.service.impl;

import com.sandy.aiot.automation.engine.exception.ConfigurationException;
import com.sandy.aiot.automation.engine.model.DeviceGroup;
import com.sandy.aiot.automation.engine.service.DeviceChannel;
import com.sandy.aiot.automation.engine.service.DeviceStateCache;
import com.sandy.aiot.automation.engine.service.GroupManager;
import com.sandy.aiot.automation.engine.service.SnapshotPersistenceService;
import com.sandy.aiot.automation.engine.vo.CommandResult;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Device groups with nested child groups. Group commands fan out to every member device,
 * child groups included; a group reachable twice is visited once.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultGroupManager implements GroupManager {

    public static final String COLLECTION = "groups";

    private final DeviceChannel deviceChannel;
    private final DeviceStateCache deviceStateCache;
    private final SnapshotPersistenceService snapshots;
    private final Map<String, DeviceGroup> groups = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (DeviceGroup g : snapshots.register(COLLECTION, DeviceGroup.class, this::listGroups)) {
            if (g.getId() != null) groups.put(g.getId(), g);
        }
    }

    public DeviceGroup saveGroup(DeviceGroup group) {
        if (group == null || group.getId() == null || group.getId().isBlank()) {
            throw new ConfigurationException("Group id is required");
        }
        if (group.getChildGroups() != null && group.getChildGroups().contains(group.getId())) {
            throw new ConfigurationException("Group " + group.getId() + " cannot contain itself");
        }
        DeviceGroup copy = DeviceGroup.builder()
                .id(group.getId())
                .name(group.getName() != null ? group.getName() : group.getId())
                .description(group.getDescription())
                .devices(group.getDevices() == null ? List.of() : List.copyOf(group.getDevices()))
                .childGroups(group.getChildGroups() == null ? List.of() : List.copyOf(group.getChildGroups()))
                .build();
        groups.put(copy.getId(), copy);
        snapshots.markDirty(COLLECTION);
        log.info("Group saved id={} devices={} children={}", copy.getId(), copy.getDevices().size(), copy.getChildGroups().size());
        return copy;
    }

    public boolean removeGroup(String groupId) {
        boolean removed = groups.remove(groupId) != null;
        if (removed) snapshots.markDirty(COLLECTION);
        return removed;
    }

    public Optional<DeviceGroup> getGroup(String groupId) {
        return Optional.ofNullable(groups.get(groupId));
    }

    public List<DeviceGroup> listGroups() {
        return groups.values().stream().sorted(Comparator.comparing(DeviceGroup::getId)).toList();
    }

    /** Member devices of the group and all of its descendants, in discovery order. */
    public Set<String> memberDevices(String groupId) {
        Set<String> devices = new LinkedHashSet<>();
        collect(groupId, devices, new HashSet<>());
        return devices;
    }

    private void collect(String groupId, Set<String> devices, Set<String> visited) {
        if (!visited.add(groupId)) return;
        DeviceGroup g = groups.get(groupId);
        if (g == null) return;
        if (g.getDevices() != null) devices.addAll(g.getDevices());
        if (g.getChildGroups() != null) {
            for (String child : g.getChildGroups()) collect(child, devices, visited);
        }
    }

    @Override
    public CommandResult controlGroup(String groupId, String command, Map<String, Object> parameters) {
        if (!groups.containsKey(groupId)) return CommandResult.fail("unknown group " + groupId);
        Map<String, Object> perDevice = new LinkedHashMap<>();
        int ok = 0;
        Set<String> devices = memberDevices(groupId);
        for (String deviceId : devices) {
            try {
                CommandResult r = deviceChannel.send(deviceId, command, parameters);
                boolean success = r != null && r.isSuccess();
                perDevice.put(deviceId, success ? "ok" : (r == null ? "no reply" : r.getMessage()));
                if (success) ok++;
            } catch (RuntimeException e) {
                perDevice.put(deviceId, e.getMessage());
                log.warn("Group command failed group={} device={} error={}", groupId, deviceId, e.getMessage());
            }
        }
        String message = String.format("%d/%d devices accepted %s", ok, devices.size(), command);
        log.info("Group command group={} command={} {}", groupId, command, message);
        return ok == devices.size() ? CommandResult.ok(message, perDevice)
                : new CommandResult(false, message, perDevice);
    }

    @Override
    public Map<String, Object> groupStatus(String groupId) {
        DeviceGroup g = groups.get(groupId);
        if (g == null) return Map.of();
        Set<String> devices = memberDevices(groupId);
        long online = devices.stream().filter(deviceStateCache::isOnline).count();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("id", g.getId());
        status.put("name", g.getName());
        status.put("device_count", devices.size());
        status.put("online_devices", (int) online);
        status.put("all_online", !devices.isEmpty() && online == devices.size());
        status.put("devices", List.copyOf(devices));
        return status;
    }
}
