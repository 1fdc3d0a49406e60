package com.imperium.unbuilt.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.imperium.unbuilt.model.entity.SuggestedQuestion;

/**
 * 推荐问题读写。
 */
public interface SuggestedQuestionService extends IService<SuggestedQuestion> {
}
