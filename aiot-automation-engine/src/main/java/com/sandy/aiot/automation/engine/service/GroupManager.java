package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.vo.CommandResult;

import java.util.Map;

public interface GroupManager {
    /** Sends the command to every device of the group and of its child groups. */
    CommandResult controlGroup(String groupId, String command, Map<String, Object> parameters);

    /** Aggregated state of the group, empty when the group is unknown. */
    Map<String, Object> groupStatus(String groupId);
}
