package com.wingz.api.ride.service.window;

import lombok.Value;

@Value
public class DescriptionCount {
    String description;
    long count;
}
