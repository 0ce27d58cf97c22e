package com.sandy.aiot.automation.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Named set of devices; commands sent to a group also reach its child groups.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeviceGroup {
    private String id;
    private String name;
    private String description;
    private List<String> devices;
    private List<String> childGroups;
}
