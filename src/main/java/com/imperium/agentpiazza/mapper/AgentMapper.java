package com.imperium.agentpiazza.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.imperium.agentpiazza.model.entity.Agent;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface AgentMapper extends BaseMapper<Agent> {
}
