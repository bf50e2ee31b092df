package com.di.insightnova.alert;

public enum AlertSourceType {
    INSIGHT,
    ANOMALY
}
