package com.microblog.admin.application.port.in;

import com.microblog.admin.application.port.out.AdminDataPort.DataCounts;

public interface GetStatsUseCase {

    DataCounts getStats();
}
