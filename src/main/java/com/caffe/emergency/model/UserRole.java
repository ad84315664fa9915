package com.caffe.emergency.model;

public enum UserRole {
    OBSERVER,
    COORDINATOR,
    SUPERVISOR,
    ADMIN
}
