package com.craftsman.coordinator.role;

import com.craftsman.coordinator.model.CoordinationException;
import com.craftsman.coordinator.model.ErrorKind;

public class UnknownRoleException extends CoordinationException {
    public UnknownRoleException(String roleId) {
        super(ErrorKind.UNKNOWN_ROLE, "No role registered with id: '" + roleId + "'");
    }
}
