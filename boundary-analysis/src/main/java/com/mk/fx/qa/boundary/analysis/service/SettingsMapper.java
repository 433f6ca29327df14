package com.mk.fx.qa.boundary.analysis.service;

import com.mk.fx.qa.boundary.analysis.cfg.AnalysisProperties;
import com.mk.fx.qa.boundary.analysis.dto.AnalysisSettingsRequest;
import org.mapstruct.BeanMapping;
import org.mapstruct.Mapper;
import org.mapstruct.MappingTarget;
import org.mapstruct.NullValuePropertyMappingStrategy;

@Mapper(componentModel = "spring")
public interface SettingsMapper {

  AnalysisProperties.Settings copy(AnalysisProperties.Settings source);

  @BeanMapping(nullValuePropertyMappingStrategy = NullValuePropertyMappingStrategy.IGNORE)
  void applyOverrides(
      AnalysisSettingsRequest overrides, @MappingTarget AnalysisProperties.Settings target);
}
