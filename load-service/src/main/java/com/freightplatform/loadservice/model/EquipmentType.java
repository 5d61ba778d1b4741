package com.freightplatform.loadservice.model;

public enum EquipmentType {
    DRY_VAN,
    REFRIGERATED,
    FLATBED
}
