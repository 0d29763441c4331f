package com.kpibench.domain.formula;

import lombok.Value;

@Value
public class AggregateReference {

    String name;
    int periodOffset;
}
