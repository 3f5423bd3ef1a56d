package com.example.DnsQueryLog.repository;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReplayStats {

    private int accepted;
    private int skipped;   // undecodable records
    private int outside;   // decoded but older than the time window
    private boolean stoppedEarly;
}
