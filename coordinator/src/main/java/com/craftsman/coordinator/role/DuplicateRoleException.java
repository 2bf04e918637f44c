package com.craftsman.coordinator.role;

import com.craftsman.coordinator.model.CoordinationException;
import com.craftsman.coordinator.model.ErrorKind;

public class DuplicateRoleException extends CoordinationException {
    public DuplicateRoleException(String roleId) {
        super(ErrorKind.DUPLICATE_ROLE, "Role already registered: '" + roleId + "'");
    }
}
