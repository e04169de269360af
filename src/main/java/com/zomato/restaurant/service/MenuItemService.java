package com.zomato.restaurant.service;

import com.zomato.common.config.CacheConfig;
import com.zomato.common.exception.BusinessException;
import com.zomato.common.exception.ErrorCode;
import com.zomato.restaurant.dto.MenuItemResponse;
import com.zomato.restaurant.entity.MenuItem;
import com.zomato.restaurant.repository.MenuItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Menu item maintenance.
 *
 * <p>A price change only affects orders placed afterwards: order items keep the
 * price they captured at placement time.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class MenuItemService {

    private final MenuItemRepository menuItemRepository;

    public MenuItem getMenuItem(Long menuItemId) {
        return menuItemRepository.findById(menuItemId)
                .orElseThrow(() -> new BusinessException(ErrorCode.MENU_ITEM_NOT_FOUND,
                        "Menu item " + menuItemId + " not found"));
    }

    @Transactional
    @CacheEvict(value = CacheConfig.RESTAURANT_MENUS, allEntries = true)
    public MenuItemResponse changePrice(Long menuItemId, BigDecimal newPrice) {
        if (newPrice == null || newPrice.signum() <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "price must be positive");
        }
        MenuItem menuItem = getMenuItem(menuItemId);
        BigDecimal oldPrice = menuItem.getPrice();
        menuItem.changePrice(newPrice);
        log.info("Menu item price changed: menuItemId={}, {} -> {}", menuItemId, oldPrice, newPrice);
        return MenuItemResponse.from(menuItem);
    }
}
