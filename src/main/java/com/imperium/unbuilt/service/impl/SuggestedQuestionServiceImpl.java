package com.imperium.unbuilt.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.unbuilt.mapper.SuggestedQuestionMapper;
import com.imperium.unbuilt.model.entity.SuggestedQuestion;
import com.imperium.unbuilt.service.SuggestedQuestionService;
import org.springframework.stereotype.Service;

@Service
public class SuggestedQuestionServiceImpl extends ServiceImpl<SuggestedQuestionMapper, SuggestedQuestion> implements SuggestedQuestionService {
}
