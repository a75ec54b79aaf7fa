package com.lphedge.hedge.port;

import com.lphedge.hedge.FuturesPositionRecord;

import java.util.List;

public interface FuturesPositionSource {

  List<FuturesPositionRecord> getPosition(String symbol);
}
