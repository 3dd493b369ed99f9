package com.ordergateway.mapper;

import com.ordergateway.api.dto.response.OrderResponse;
import com.ordergateway.domain.model.Order;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/**
 * MapStruct mapper for converting the Order domain model to OrderResponse DTOs.
 * direction comes from {@link Order#getDirection()}; orderType is the caller-facing code.
 */
@Mapper
public interface OrderResponseMapper {

    @Mapping(target = "orderType", expression = "java(order.getType() != null ? order.getType().getCode() : null)")
    OrderResponse toResponse(Order order);

    List<OrderResponse> toResponseList(List<Order> orders);
}
