package com.caffe.emergency.dto;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SystemTestResultDTO {
    private boolean success;
    private String message;
}
