package com.bulkvalidate.app;

import com.bulkvalidate.engine.PoolConfig;

public class AppConfig {
    public String inputPath = "customers.jsonl";
    public String outputPath;           // null => stdout
    public int workers = 0;             // requested; clamped by the pool config
    public long timeoutMs = 0;          // 0 => run to completion
    public PoolConfig pool = new PoolConfig();

    public AppConfig() {}
}
