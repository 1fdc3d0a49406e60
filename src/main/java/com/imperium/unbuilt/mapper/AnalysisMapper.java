package com.imperium.unbuilt.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.unbuilt.model.entity.Analysis;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface AnalysisMapper extends BaseMapper<Analysis> {
}
