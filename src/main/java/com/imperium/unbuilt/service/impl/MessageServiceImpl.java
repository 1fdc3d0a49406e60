package com.imperium.unbuilt.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.imperium.unbuilt.mapper.MessageMapper;
import com.imperium.unbuilt.model.entity.Message;
import com.imperium.unbuilt.service.MessageService;
import org.springframework.stereotype.Service;

@Service
public class MessageServiceImpl extends ServiceImpl<MessageMapper, Message> implements MessageService {
}
