package com.xxl.job.lite.biz.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IdleBeatParam implements Serializable {

    private static final long serialVersionUID = 42L;

    private int jobId;

}
