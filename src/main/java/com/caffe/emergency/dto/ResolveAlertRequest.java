package com.caffe.emergency.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolveAlertRequest {
    private String resolution;
}
