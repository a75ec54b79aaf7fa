package com.lphedge.hedge.port;

public interface Notifier {

  void push(String text);
}
