package com.rfpanalytics.domain.model;

public enum LifecycleState {
    SUBMITTED,
    DECLINED
}
