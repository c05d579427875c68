package com.modelrouter.service;

import com.modelrouter.model.routing.UsageRecord;

public interface UsageRecordSink {

    void write(UsageRecord record);
}
